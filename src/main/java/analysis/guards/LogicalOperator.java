package analysis.guards;

/**
 * Short-circuit logical operators. Each operator is defined by what happens once its left operand is known: either
 * the whole expression is decided without evaluating the right operand, or the whole takes the value of the right
 * operand.
 *
 * <pre>
 *            left true       left false
 *   AND      right           false
 *   OR       true            right
 * </pre>
 *
 * Which operand values are implied by a value of the whole is derived from this table.
 */
public enum LogicalOperator {
    AND("&&", null, Boolean.FALSE), OR("||", Boolean.TRUE, null);

    private static final boolean[] BOOLEANS = { true, false };

    private final String symbol;
    /**
     * Value of the whole when the left operand is true, null if the right operand decides
     */
    private final Boolean whenLeftTrue;
    /**
     * Value of the whole when the left operand is false, null if the right operand decides
     */
    private final Boolean whenLeftFalse;

    private LogicalOperator(String symbol, Boolean whenLeftTrue, Boolean whenLeftFalse) {
        this.symbol = symbol;
        this.whenLeftTrue = whenLeftTrue;
        this.whenLeftFalse = whenLeftFalse;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Value of the whole expression once the left operand is known
     *
     * @param left
     *            value of the left operand
     * @return value of the whole, null if the right operand has to be evaluated and decides
     */
    public Boolean shortCircuit(boolean left) {
        return left ? whenLeftTrue : whenLeftFalse;
    }

    /**
     * Evaluate with short-circuit semantics
     *
     * @param left
     *            value of the left operand
     * @param right
     *            value of the right operand, ignored if the left operand decides
     * @return value of the whole
     */
    public boolean evaluate(boolean left, boolean right) {
        Boolean decided = shortCircuit(left);
        return decided != null ? decided : right;
    }

    /**
     * Value an operand must have had if the whole expression evaluated to <code>wholeIsTrue</code>
     *
     * @param leftOperand
     *            true for the left operand, false for the right
     * @param wholeIsTrue
     *            value of the whole expression
     * @return the value of the operand implied by the value of the whole, null if the operand could have either value
     */
    public Boolean impliedOperandValue(boolean leftOperand, boolean wholeIsTrue) {
        Boolean implied = null;
        boolean seen = false;
        for (boolean l : BOOLEANS) {
            for (boolean r : BOOLEANS) {
                if (evaluate(l, r) != wholeIsTrue) {
                    continue;
                }
                boolean operand = leftOperand ? l : r;
                if (!seen) {
                    implied = operand;
                    seen = true;
                }
                else if (implied != null && implied != operand) {
                    return null;
                }
            }
        }
        return implied;
    }
}
