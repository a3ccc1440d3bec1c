package analysis.guards.cfg;

/**
 * Value whose definition the guard analysis does not look into, e.g. a formal parameter, a load or a phi.
 */
public final class ValueInstruction extends Instruction {

    /**
     * Name from the source code (if any)
     */
    private final String name;

    ValueInstruction(int valueNumber, BasicBlock basicBlock, String name) {
        super(valueNumber, basicBlock);
        this.name = name;
    }

    /**
     * Name from the source code
     *
     * @return name of the variable, or null if there is none
     */
    public String getName() {
        return name;
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
        return name == null ? super.valueString() : name;
    }

    @Override
    public String toString() {
        return "v" + getValueNumber() + " = " + (name == null ? "?" : name);
    }
}
