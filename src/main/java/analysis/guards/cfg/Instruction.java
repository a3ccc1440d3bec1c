package analysis.guards.cfg;

/**
 * Instruction in a control flow graph. Every instruction defines a value identified by its value number and
 * belongs to exactly one basic block. Instructions are created by a {@link ControlFlowGraphBuilder} and never
 * change afterwards.
 * <p>
 * Equality is identity, two instructions with the same shape in different places are different values.
 */
public abstract class Instruction {

    /**
     * Value number, unique within a control flow graph
     */
    private final int valueNumber;
    /**
     * Basic block containing this instruction
     */
    private final BasicBlock basicBlock;

    /**
     * Create an instruction in the given basic block
     *
     * @param valueNumber
     *            unique value number for the value defined by this instruction
     * @param basicBlock
     *            basic block containing the instruction
     */
    protected Instruction(int valueNumber, BasicBlock basicBlock) {
        assert basicBlock != null : "Instruction v" + valueNumber + " has no basic block";
        this.valueNumber = valueNumber;
        this.basicBlock = basicBlock;
    }

    /**
     * Value number of the value defined by this instruction
     *
     * @return value number, unique within the control flow graph
     */
    public final int getValueNumber() {
        return valueNumber;
    }

    /**
     * Basic block containing this instruction
     *
     * @return basic block
     */
    public final BasicBlock getBasicBlock() {
        return basicBlock;
    }

    /**
     * Number of operands read by this instruction
     *
     * @return number of uses
     */
    public abstract int getNumberOfUses();

    /**
     * Get an operand of this instruction
     *
     * @param j
     *            index of the operand, between 0 and {@link #getNumberOfUses()} (exclusive)
     * @return instruction defining the j<sup>th</sup> operand
     */
    public abstract Instruction getUse(int j);

    /**
     * Short name for the value defined by this instruction, used when printing operands
     *
     * @return name of the value
     */
    public String valueString() {
        return "v" + valueNumber;
    }

    /**
     * Check that an operand is in range
     *
     * @param j
     *            operand index
     */
    protected final void checkUse(int j) {
        if (j < 0 || j >= getNumberOfUses()) {
            throw new IndexOutOfBoundsException("No use " + j + " for " + this);
        }
    }
}
