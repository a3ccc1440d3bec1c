package analysis.guards;

/**
 * <code>!inner</code> from the source code, where the IR has no instruction for the negation
 */
public final class SyntacticNot extends GuardCondition {

    private final GuardCondition inner;

    SyntacticNot(GuardCondition inner) {
        assert inner != null;
        this.inner = inner;
    }

    /**
     * Condition being negated
     *
     * @return operand of the negation
     */
    public GuardCondition getInner() {
        return inner;
    }

    @Override
    public Kind getKind() {
        return Kind.SYNTACTIC_NOT;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SyntacticNot && ((SyntacticNot) obj).inner.equals(inner);
    }

    @Override
    public int hashCode() {
        return 17 * inner.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "!" + inner;
    }
}
