package analysis.guards.cfg;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Control flow graph for a single function, as seen by the guard analysis. Implementations must be immutable: the
 * guard analysis caches results for the lifetime of the graph and queries it from several threads.
 */
public interface ControlFlowGraph extends Iterable<BasicBlock> {

    /**
     * Name of the function this graph was built for
     *
     * @return function name
     */
    String getName();

    /**
     * First block executed
     *
     * @return entry block
     */
    BasicBlock entry();

    /**
     * Number of basic blocks, blocks are numbered from 0 to this number (exclusive)
     *
     * @return number of blocks
     */
    int getNumberOfBlocks();

    /**
     * Get a block by number
     *
     * @param number
     *            block number
     * @return basic block with the given number
     */
    BasicBlock getBlock(int number);

    /**
     * Basic blocks with an edge to the given block
     *
     * @param bb
     *            basic block
     * @return control flow predecessors
     */
    Set<BasicBlock> getPredecessors(BasicBlock bb);

    /**
     * Basic blocks with an edge from the given block
     *
     * @param bb
     *            basic block
     * @return control flow successors
     */
    Set<BasicBlock> getSuccessors(BasicBlock bb);

    /**
     * Whether there is a path from the entry to the given block
     *
     * @param bb
     *            basic block
     * @return true if the block is reachable
     */
    boolean isReachableFromEntry(BasicBlock bb);

    /**
     * Whether every path from the entry to <code>b</code> goes through <code>a</code>. This is reflexive and
     * transitive. Dominance is only computed for blocks reachable from the entry: an unreachable block is dominated
     * by itself only.
     *
     * @param a
     *            possible dominator
     * @param b
     *            possibly dominated block
     * @return true if <code>a</code> dominates <code>b</code>
     */
    boolean dominates(BasicBlock a, BasicBlock b);

    /**
     * All conditional branches in the graph
     *
     * @return conditional branch instructions
     */
    Collection<ConditionalBranchInstruction> getConditionalBranches();

    /**
     * Conditional branches that branch on the given instruction
     *
     * @param condition
     *            instruction computing a condition
     * @return branches whose condition is <code>condition</code>, empty if there are none
     */
    Collection<ConditionalBranchInstruction> getBranchesFor(Instruction condition);

    /**
     * Source-level conditions the front end recorded for logical operators the IR does not represent
     *
     * @return source conditions
     */
    List<SourceCondition> getSourceConditions();
}
