package analysis.guards.cfg;

/**
 * Two way branch ending a basic block. Control goes to the "true" target if the condition evaluates to true and to
 * the "false" target otherwise.
 */
public final class ConditionalBranchInstruction extends Instruction {

    /**
     * Condition branched on, null if the front end could not find it
     */
    private final Instruction condition;
    private final BasicBlock trueTarget;
    private final BasicBlock falseTarget;

    ConditionalBranchInstruction(int valueNumber, BasicBlock basicBlock, Instruction condition,
                                 BasicBlock trueTarget, BasicBlock falseTarget) {
        super(valueNumber, basicBlock);
        this.condition = condition;
        this.trueTarget = trueTarget;
        this.falseTarget = falseTarget;
    }

    /**
     * Condition for this branch
     *
     * @return instruction computing the condition, null if unknown
     */
    public Instruction getCondition() {
        return condition;
    }

    /**
     * Basic block on the outgoing "true" edge
     *
     * @return successor taken when the condition is true
     */
    public BasicBlock getTrueTarget() {
        return trueTarget;
    }

    /**
     * Basic block on the outgoing "false" edge
     *
     * @return successor taken when the condition is false
     */
    public BasicBlock getFalseTarget() {
        return falseTarget;
    }

    /**
     * Basic block on the outgoing edge labelled with the given truth value
     *
     * @param testIsTrue
     *            label of the edge
     * @return successor taken when the condition evaluates to <code>testIsTrue</code>
     */
    public BasicBlock getTarget(boolean testIsTrue) {
        return testIsTrue ? trueTarget : falseTarget;
    }

    @Override
    public int getNumberOfUses() {
        return condition == null ? 0 : 1;
    }

    @Override
    public Instruction getUse(int j) {
        checkUse(j);
        return condition;
    }

    @Override
    public String toString() {
        return "if (" + (condition == null ? "?" : condition.valueString()) + ") goto BB" + trueTarget.getNumber()
                + " else BB" + falseTarget.getNumber();
    }
}
