package analysis.guards.cfg;

/**
 * Boolean negation that the IR keeps as an instruction (e.g. when <code>!x</code> is stored in a variable rather
 * than branched on directly)
 */
public final class LogicalNotInstruction extends Instruction {

    private final Instruction operand;

    LogicalNotInstruction(int valueNumber, BasicBlock basicBlock, Instruction operand) {
        super(valueNumber, basicBlock);
        this.operand = operand;
    }

    /**
     * Value being negated
     *
     * @return operand
     */
    public Instruction getOperand() {
        return operand;
    }

    @Override
    public int getNumberOfUses() {
        return 1;
    }

    @Override
    public Instruction getUse(int j) {
        checkUse(j);
        return operand;
    }

    @Override
    public String toString() {
        return valueString() + " = !" + operand.valueString();
    }
}
