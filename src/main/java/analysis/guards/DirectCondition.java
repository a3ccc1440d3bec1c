package analysis.guards;

import analysis.guards.cfg.Instruction;

/**
 * Guard condition that is present in the IR: the condition instruction of one or more conditional branches
 */
public final class DirectCondition extends GuardCondition {

    private final Instruction instruction;

    DirectCondition(Instruction instruction) {
        assert instruction != null;
        this.instruction = instruction;
    }

    /**
     * Instruction branched on
     *
     * @return condition instruction
     */
    public Instruction getInstruction() {
        return instruction;
    }

    @Override
    public Kind getKind() {
        return Kind.DIRECT;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DirectCondition && ((DirectCondition) obj).instruction == instruction;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(instruction);
    }

    @Override
    public String toString() {
        return instruction.valueString();
    }
}
