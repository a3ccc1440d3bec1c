package analysis.guards.cfg;

/**
 * Integer literal
 */
public final class ConstantInstruction extends Instruction {

    private final long value;

    ConstantInstruction(int valueNumber, BasicBlock basicBlock, long value) {
        super(valueNumber, basicBlock);
        this.value = value;
    }

    /**
     * Literal value of this constant
     *
     * @return integer value
     */
    public long getValue() {
        return value;
    }

    @Override
    public int getNumberOfUses() {
        return 0;
    }

    @Override
    public Instruction getUse(int j) {
        checkUse(j);
        return null;
    }

    @Override
    public String valueString() {
        return Long.toString(value);
    }

    @Override
    public String toString() {
        return valueString() + " = #" + value;
    }
}
