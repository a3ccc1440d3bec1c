package analysis.guards.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Straight-line sequence of instructions. Instructions are appended by the {@link ControlFlowGraphBuilder} that
 * created the block and the block cannot change once the graph is built.
 */
public final class BasicBlock implements Iterable<Instruction> {

    /**
     * Number of this block, block 0 is the entry
     */
    private final int number;
    /**
     * Builder that created this block
     */
    private final ControlFlowGraphBuilder owner;
    /**
     * Instructions in execution order
     */
    private List<Instruction> instructions = new ArrayList<>();

    BasicBlock(int number, ControlFlowGraphBuilder owner) {
        this.number = number;
        this.owner = owner;
    }

    /**
     * Number of this basic block, unique within the control flow graph
     *
     * @return block number
     */
    public int getNumber() {
        return number;
    }

    /**
     * Whether this is the first block executed
     *
     * @return true if this is the entry block
     */
    public boolean isEntryBlock() {
        return number == 0;
    }

    /**
     * Instructions in this block, in execution order
     *
     * @return unmodifiable list of instructions
     */
    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    /**
     * Get the last instruction of this basic block
     *
     * @return last instruction, null if the block is empty
     */
    public Instruction getLastInstruction() {
        if (instructions.isEmpty()) {
            return null;
        }
        return instructions.get(instructions.size() - 1);
    }

    @Override
    public Iterator<Instruction> iterator() {
        return getInstructions().iterator();
    }

    ControlFlowGraphBuilder getOwner() {
        return owner;
    }

    void append(Instruction i) {
        instructions.add(i);
    }

    /**
     * Prevent any further changes
     */
    void seal() {
        instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
    }

    @Override
    public String toString() {
        return "BB" + number;
    }
}
