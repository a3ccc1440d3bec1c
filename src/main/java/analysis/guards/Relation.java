package analysis.guards;

/**
 * The two shapes a normalized comparison can take
 */
public enum Relation {
    /**
     * <code>left &lt; right + k</code>
     */
    LT("<"),
    /**
     * <code>left == right + k</code>
     */
    EQ("==");

    private final String symbol;

    private Relation(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Evaluate <code>left REL right + k</code> on concrete integers
     *
     * @param left
     *            value of the left operand
     * @param right
     *            value of the right operand
     * @param k
     *            constant offset
     * @return whether the relation holds
     */
    public boolean holds(long left, long right, long k) {
        long shifted;
        try {
            shifted = Math.addExact(right, k);
        }
        catch (ArithmeticException e) {
            // right + k is out of range, compare against the sign of the overflow
            boolean aboveMax = k > 0;
            return this == LT && aboveMax;
        }
        return this == LT ? left < shifted : left == shifted;
    }
}
