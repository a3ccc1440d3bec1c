package analysis.guards;

/**
 * Short-circuit <code>left &amp;&amp; right</code> or <code>left || right</code> from the source code
 */
public final class LogicalCombinator extends GuardCondition {

    private final LogicalOperator operator;
    private final GuardCondition left;
    private final GuardCondition right;
    private final int memoizedHashCode;

    LogicalCombinator(LogicalOperator operator, GuardCondition left, GuardCondition right) {
        assert operator != null && left != null && right != null;
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.memoizedHashCode = 31 * (31 * operator.hashCode() + left.hashCode()) + right.hashCode();
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public GuardCondition getLeft() {
        return left;
    }

    public GuardCondition getRight() {
        return right;
    }

    /**
     * Get one of the operands
     *
     * @param leftOperand
     *            true for the left operand
     * @return the requested operand
     */
    public GuardCondition getOperand(boolean leftOperand) {
        return leftOperand ? left : right;
    }

    @Override
    public Kind getKind() {
        return Kind.LOGICAL_COMBINATOR;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LogicalCombinator)) {
            return false;
        }
        LogicalCombinator other = (LogicalCombinator) obj;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
