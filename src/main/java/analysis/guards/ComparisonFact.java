package analysis.guards;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import analysis.guards.cfg.Instruction;

/**
 * Fact implied by the truth value of a condition: "if the condition evaluates to <code>testIsTrue</code> then
 * <code>left REL right + k</code> evaluates to <code>value</code>".
 * <p>
 * Facts are immutable values; two facts are equal if all six components are (operands are compared by identity).
 */
public final class ComparisonFact {

    /**
     * Truth value of the condition
     */
    private final boolean testIsTrue;
    private final Instruction left;
    private final Instruction right;
    private final long k;
    private final Relation relation;
    /**
     * Truth value of <code>left REL right + k</code> when the condition evaluates to {@link #testIsTrue}
     */
    private final boolean value;
    private final int memoizedHashCode;

    public ComparisonFact(boolean testIsTrue, Instruction left, Instruction right, long k, Relation relation,
                          boolean value) {
        assert left != null && right != null : "null operand in comparison fact";
        this.testIsTrue = testIsTrue;
        this.left = left;
        this.right = right;
        this.k = k;
        this.relation = relation;
        this.value = value;
        this.memoizedHashCode = computeHashCode();
    }

    public boolean getTestIsTrue() {
        return testIsTrue;
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

    public boolean getValue() {
        return value;
    }

    /**
     * The same implication stated for a different truth value of the condition, used when the condition is negated
     * or when a fact of an operand is forwarded to a compound condition
     *
     * @param newTestIsTrue
     *            truth value of the (new) condition
     * @return fact with the condition truth value replaced
     */
    public ComparisonFact withTestIsTrue(boolean newTestIsTrue) {
        if (newTestIsTrue == testIsTrue) {
            return this;
        }
        return new ComparisonFact(newTestIsTrue, left, right, k, relation, value);
    }

    /**
     * Whether this fact says the same thing as <code>other</code> about the same comparison except for the value
     *
     * @param other
     *            another fact
     * @return true if the two facts contradict each other
     */
    public boolean contradicts(ComparisonFact other) {
        return testIsTrue == other.testIsTrue && left == other.left && right == other.right && k == other.k
                && relation == other.relation && value != other.value;
    }

    /**
     * Remove the facts for every truth value of a condition that implies a contradiction. Such a truth value can never
     * be observed (e.g. <code>x &lt; y &amp;&amp; x &gt;= y</code> evaluating to true), the facts for it are vacuous and
     * are not reported.
     *
     * @param facts
     *            facts for one condition
     * @return the facts for the truth values that do not lead to a contradiction
     */
    public static Set<ComparisonFact> removeUnsatisfiable(Collection<ComparisonFact> facts) {
        boolean[] unsat = new boolean[2];
        for (ComparisonFact f : facts) {
            ComparisonFact opposite = new ComparisonFact(f.testIsTrue, f.left, f.right, f.k, f.relation, !f.value);
            if (facts.contains(opposite)) {
                unsat[f.testIsTrue ? 1 : 0] = true;
            }
        }
        Set<ComparisonFact> result = new LinkedHashSet<>();
        for (ComparisonFact f : facts) {
            if (!unsat[f.testIsTrue ? 1 : 0]) {
                result.add(f);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ComparisonFact)) {
            return false;
        }
        ComparisonFact other = (ComparisonFact) obj;
        return testIsTrue == other.testIsTrue && value == other.value && k == other.k && left == other.left
                && right == other.right && relation == other.relation;
    }

    private int computeHashCode() {
        int result = 31 * System.identityHashCode(left) + System.identityHashCode(right);
        result = 31 * result + Long.hashCode(k);
        result = 31 * result + relation.hashCode();
        result = 31 * result + (testIsTrue ? 1 : 0);
        return 31 * result + (value ? 1 : 0);
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public String toString() {
        return "if " + testIsTrue + " then " + left.valueString() + " " + relation.getSymbol() + " "
                + right.valueString() + " + " + k + " is " + value;
    }
}
