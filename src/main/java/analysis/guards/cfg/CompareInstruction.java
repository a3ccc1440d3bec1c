package analysis.guards.cfg;

/**
 * Integer comparison producing a boolean
 */
public final class CompareInstruction extends Instruction {

    /**
     * Comparison operators
     */
    public enum Operator {
        EQ("=="), NE("!="), LT("<"), GE(">="), GT(">"), LE("<=");

        private final String symbol;

        private Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /**
         * Evaluate this operator on concrete integers
         *
         * @param l
         *            left operand
         * @param r
         *            right operand
         * @return result of <code>l op r</code>
         */
        public boolean evaluate(long l, long r) {
            switch (this) {
            case EQ:
                return l == r;
            case NE:
                return l != r;
            case LT:
                return l < r;
            case GE:
                return l >= r;
            case GT:
                return l > r;
            case LE:
                return l <= r;
            }
            throw new IllegalStateException("Unknown comparison " + this);
        }
    }

    private final Operator operator;
    private final Instruction left;
    private final Instruction right;

    CompareInstruction(int valueNumber, BasicBlock basicBlock, Operator operator, Instruction left,
                       Instruction right) {
        super(valueNumber, basicBlock);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public Instruction getLeft() {
        return left;
    }

    public Instruction getRight() {
        return right;
    }

    @Override
    public int getNumberOfUses() {
        return 2;
    }

    @Override
    public Instruction getUse(int j) {
        checkUse(j);
        return j == 0 ? left : right;
    }

    @Override
    public String toString() {
        return valueString() + " = " + left.valueString() + " " + operator.getSymbol() + " " + right.valueString();
    }
}
