package analysis.guards;

import java.util.LinkedHashSet;
import java.util.Set;

import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.ConditionalBranchInstruction;
import analysis.guards.cfg.ControlFlowGraph;

/**
 * Decides which blocks a guard condition controls. A condition controls a block for a truth value if the block can
 * only be reached after the condition evaluated to that truth value.
 * <p>
 * For a condition in the IR this is a local dominance query: the edge out of the branch labelled with the truth value
 * has to be the only way into its target (other than back edges from blocks the target dominates, or edges from
 * unreachable blocks), and the target has to dominate the block. Negations swap the truth value. A short-circuit
 * operator controls a block only if both of its operands do.
 */
class ControlsEngine {

    private final ControlFlowGraph cfg;
    /**
     * Used for (cached) results of sub-conditions
     */
    private final GuardAnalysisSession session;

    ControlsEngine(ControlFlowGraph cfg, GuardAnalysisSession session) {
        this.cfg = cfg;
        this.session = session;
    }

    /**
     * Compute the set of blocks controlled by a guard condition
     *
     * @param cond
     *            guard condition
     * @param testIsTrue
     *            truth value of the condition
     * @return new set of the blocks that are only reached when <code>cond</code> evaluates to <code>testIsTrue</code>
     */
    Set<BasicBlock> computeControlledBlocks(GuardCondition cond, boolean testIsTrue) {
        switch (cond.getKind()) {
        case DIRECT:
            Set<BasicBlock> controlled = new LinkedHashSet<>();
            for (ConditionalBranchInstruction br : cfg.getBranchesFor(((DirectCondition) cond).getInstruction())) {
                addControlledBlocks(br, testIsTrue, controlled);
            }
            return controlled;
        case SYNTACTIC_NOT:
            return new LinkedHashSet<>(session.getControlledBlocks(((SyntacticNot) cond).getInner(), !testIsTrue));
        case LOGICAL_COMBINATOR:
            LogicalCombinator lc = (LogicalCombinator) cond;
            Set<BasicBlock> both = new LinkedHashSet<>(session.getControlledBlocks(lc.getLeft(), testIsTrue));
            both.retainAll(session.getControlledBlocks(lc.getRight(), testIsTrue));
            return both;
        }
        throw new IllegalStateException("Unknown guard condition kind " + cond.getKind());
    }

    /**
     * Add the blocks controlled by the edge of a branch labelled with the given truth value
     */
    private void addControlledBlocks(ConditionalBranchInstruction br, boolean testIsTrue, Set<BasicBlock> controlled) {
        BasicBlock succ = br.getTarget(testIsTrue);
        if (succ == null || succ == br.getTarget(!testIsTrue)) {
            // both edges lead to the same place, the condition decides nothing
            return;
        }
        if (!hasDominatingEdgeTo(br.getBasicBlock(), succ)) {
            return;
        }
        for (BasicBlock bb : cfg) {
            if (cfg.dominates(succ, bb)) {
                controlled.add(bb);
            }
        }
    }

    /**
     * Whether every path from the entry to <code>succ</code> goes through the edge from <code>branchBlock</code>
     *
     * @param branchBlock
     *            block ending in the branch
     * @param succ
     *            target of one edge out of the branch
     * @return true if any other predecessor of <code>succ</code> can only be reached through <code>succ</code>
     */
    private boolean hasDominatingEdgeTo(BasicBlock branchBlock, BasicBlock succ) {
        if (!cfg.isReachableFromEntry(branchBlock)) {
            return false;
        }
        if (succ == branchBlock || !cfg.dominates(branchBlock, succ)) {
            // e.g. an edge back to the entry or to the branch itself
            return false;
        }
        for (BasicBlock pred : cfg.getPredecessors(succ)) {
            if (pred == branchBlock) {
                continue;
            }
            // back edge from a loop body, or an edge that can never be taken
            if (cfg.dominates(succ, pred) || !cfg.isReachableFromEntry(pred)) {
                continue;
            }
            return false;
        }
        return true;
    }
}
