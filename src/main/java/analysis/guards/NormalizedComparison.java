package analysis.guards;

import analysis.guards.cfg.Instruction;

/**
 * Comparison rewritten to <code>left &lt; right + k</code> or <code>left == right + k</code>, together with the
 * value that shape takes when the original comparison is true.
 */
public final class NormalizedComparison {

    private final Instruction left;
    private final Instruction right;
    private final long k;
    private final Relation relation;
    /**
     * Value of the normalized shape when the original comparison holds
     */
    private final boolean value;

    NormalizedComparison(Instruction left, Instruction right, long k, Relation relation, boolean value) {
        this.left = left;
        this.right = right;
        this.k = k;
        this.relation = relation;
        this.value = value;
    }

    public Instruction getLeft() {
        return left;
    }

    public Instruction getRight() {
        return right;
    }

    public long getK() {
        return k;
    }

    public Relation getRelation() {
        return relation;
    }

    /**
     * Value of <code>left REL right + k</code> when the original comparison is true
     *
     * @return true if the shape has the same truth value as the comparison, false if it is the negation
     */
    public boolean getValue() {
        return value;
    }

    /**
     * Re-expand this normalized form on concrete operand values: compute the truth value of the original comparison
     * given the values of the operands it is stated over.
     *
     * @param leftValue
     *            value of {@link #getLeft()}
     * @param rightValue
     *            value of {@link #getRight()}
     * @return truth value of the original comparison
     */
    public boolean evaluate(long leftValue, long rightValue) {
        return relation.holds(leftValue, rightValue, k) == value;
    }

    @Override
    public String toString() {
        return (value ? "" : "!(") + left.valueString() + " " + relation.getSymbol() + " " + right.valueString()
                + " + " + k + (value ? "" : ")");
    }
}
