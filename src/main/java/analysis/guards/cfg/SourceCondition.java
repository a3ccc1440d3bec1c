package analysis.guards.cfg;

/**
 * Condition as written in the source code. A front end whose IR lowers <code>&amp;&amp;</code>,
 * <code>||</code> and <code>!</code> into branches records the original shape of the condition with these trees.
 * The leaves are instructions, usually the conditions of the branches the operators were lowered to.
 */
public final class SourceCondition {

    /**
     * Shape of a source condition
     */
    public enum Kind {
        INSTRUCTION, AND, OR, NOT
    }

    private final Kind kind;
    /**
     * Leaf instruction, only for {@link Kind#INSTRUCTION}
     */
    private final Instruction instruction;
    /**
     * First operand for AND/OR, the operand for NOT
     */
    private final SourceCondition left;
    /**
     * Second operand for AND/OR
     */
    private final SourceCondition right;

    private SourceCondition(Kind kind, Instruction instruction, SourceCondition left, SourceCondition right) {
        this.kind = kind;
        this.instruction = instruction;
        this.left = left;
        this.right = right;
    }

    /**
     * Leaf condition computed by an instruction
     *
     * @param i
     *            instruction computing the condition
     * @return source condition
     */
    public static SourceCondition of(Instruction i) {
        if (i == null) {
            throw new IllegalArgumentException("null instruction in source condition");
        }
        return new SourceCondition(Kind.INSTRUCTION, i, null, null);
    }

    public static SourceCondition and(SourceCondition left, SourceCondition right) {
        return binary(Kind.AND, left, right);
    }

    public static SourceCondition or(SourceCondition left, SourceCondition right) {
        return binary(Kind.OR, left, right);
    }

    public static SourceCondition not(SourceCondition operand) {
        if (operand == null) {
            throw new IllegalArgumentException("null operand for NOT");
        }
        return new SourceCondition(Kind.NOT, null, operand, null);
    }

    private static SourceCondition binary(Kind kind, SourceCondition left, SourceCondition right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("null operand for " + kind);
        }
        return new SourceCondition(kind, null, left, right);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Instruction for a leaf
     *
     * @return instruction, null unless this is an {@link Kind#INSTRUCTION} leaf
     */
    public Instruction getInstruction() {
        return instruction;
    }

    /**
     * Left operand of AND/OR or the operand of NOT
     *
     * @return operand, null for a leaf
     */
    public SourceCondition getLeft() {
        return left;
    }

    /**
     * Right operand of AND/OR
     *
     * @return operand, null for leaves and NOT
     */
    public SourceCondition getRight() {
        return right;
    }

    @Override
    public String toString() {
        switch (kind) {
        case INSTRUCTION:
            return instruction.valueString();
        case AND:
            return "(" + left + " && " + right + ")";
        case OR:
            return "(" + left + " || " + right + ")";
        case NOT:
            return "!" + left;
        }
        throw new IllegalStateException("Unknown kind " + kind);
    }
}
