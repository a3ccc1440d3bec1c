package analysis.guards.cfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ibm.wala.util.graph.NumberedGraph;
import com.ibm.wala.util.graph.dominators.Dominators;
import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;
import com.ibm.wala.util.graph.traverse.DFS;

/**
 * Control flow graph produced by a {@link ControlFlowGraphBuilder}. Reachability, edges and the dominator tree are
 * computed once, when the graph is created, and stored in arrays indexed by block number so that queries do not
 * touch the underlying graph.
 */
final class ImmutableControlFlowGraph implements ControlFlowGraph {

    private final String name;
    /**
     * Blocks indexed by number
     */
    private final List<BasicBlock> blocks;
    /**
     * Predecessors indexed by block number
     */
    private final List<Set<BasicBlock>> preds;
    /**
     * Successors indexed by block number
     */
    private final List<Set<BasicBlock>> succs;
    /**
     * Whether the block with a given number is reachable from the entry
     */
    private final boolean[] reachable;
    /**
     * Number of the immediate dominator of each block, -1 for the entry and for unreachable blocks
     */
    private final int[] idom;
    private final List<ConditionalBranchInstruction> branches;
    private final Map<Instruction, List<ConditionalBranchInstruction>> branchesByCondition;
    private final List<SourceCondition> sourceConditions;

    /**
     * Compute the graph facts for the given blocks and edges
     *
     * @param name
     *            name of the function
     * @param blocks
     *            sealed blocks indexed by number, block 0 is the entry
     * @param graph
     *            edges between the blocks
     * @param sourceConditions
     *            conditions recorded by the front end
     */
    ImmutableControlFlowGraph(String name, List<BasicBlock> blocks, NumberedGraph<BasicBlock> graph,
                              List<SourceCondition> sourceConditions) {
        assert !blocks.isEmpty() : "No entry block for " + name;
        this.name = name;
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.sourceConditions = Collections.unmodifiableList(new ArrayList<>(sourceConditions));

        int n = blocks.size();
        List<Set<BasicBlock>> p = new ArrayList<>(n);
        List<Set<BasicBlock>> s = new ArrayList<>(n);
        for (BasicBlock bb : blocks) {
            p.add(Collections.unmodifiableSet(toSet(graph.getPredNodes(bb))));
            s.add(Collections.unmodifiableSet(toSet(graph.getSuccNodes(bb))));
        }
        this.preds = Collections.unmodifiableList(p);
        this.succs = Collections.unmodifiableList(s);

        BasicBlock entry = blocks.get(0);
        this.reachable = new boolean[n];
        for (BasicBlock bb : DFS.getReachableNodes(graph, Collections.singleton(entry))) {
            reachable[bb.getNumber()] = true;
        }

        this.idom = new int[n];
        Arrays.fill(idom, -1);
        Dominators<BasicBlock> dominators = Dominators.make(reachableSubgraph(blocks, graph), entry);
        for (BasicBlock bb : blocks) {
            if (bb == entry || !reachable[bb.getNumber()]) {
                continue;
            }
            BasicBlock dom = dominators.getIdom(bb);
            assert dom != null : "No immediate dominator for reachable " + bb + " in " + name;
            idom[bb.getNumber()] = dom.getNumber();
        }

        List<ConditionalBranchInstruction> brs = new ArrayList<>();
        Map<Instruction, List<ConditionalBranchInstruction>> byCondition = new LinkedHashMap<>();
        for (BasicBlock bb : blocks) {
            Instruction last = bb.getLastInstruction();
            if (last instanceof ConditionalBranchInstruction) {
                ConditionalBranchInstruction br = (ConditionalBranchInstruction) last;
                brs.add(br);
                if (br.getCondition() != null) {
                    List<ConditionalBranchInstruction> forCondition = byCondition.get(br.getCondition());
                    if (forCondition == null) {
                        forCondition = new ArrayList<>();
                        byCondition.put(br.getCondition(), forCondition);
                    }
                    forCondition.add(br);
                }
            }
        }
        this.branches = Collections.unmodifiableList(brs);
        this.branchesByCondition = byCondition;
    }

    /**
     * Copy of the graph restricted to the blocks reachable from the entry, the dominator computation only looks at
     * these
     */
    private NumberedGraph<BasicBlock> reachableSubgraph(List<BasicBlock> bbs, NumberedGraph<BasicBlock> graph) {
        SlowSparseNumberedGraph<BasicBlock> sub = SlowSparseNumberedGraph.make();
        for (BasicBlock bb : bbs) {
            if (reachable[bb.getNumber()]) {
                sub.addNode(bb);
            }
        }
        for (BasicBlock bb : bbs) {
            if (!reachable[bb.getNumber()]) {
                continue;
            }
            Iterator<BasicBlock> iter = graph.getSuccNodes(bb);
            while (iter.hasNext()) {
                // successors of reachable blocks are reachable
                sub.addEdge(bb, iter.next());
            }
        }
        return sub;
    }

    private static Set<BasicBlock> toSet(Iterator<BasicBlock> iter) {
        Set<BasicBlock> set = new LinkedHashSet<>();
        while (iter.hasNext()) {
            set.add(iter.next());
        }
        return set;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public BasicBlock entry() {
        return blocks.get(0);
    }

    @Override
    public int getNumberOfBlocks() {
        return blocks.size();
    }

    @Override
    public BasicBlock getBlock(int number) {
        return blocks.get(number);
    }

    @Override
    public Set<BasicBlock> getPredecessors(BasicBlock bb) {
        return preds.get(index(bb));
    }

    @Override
    public Set<BasicBlock> getSuccessors(BasicBlock bb) {
        return succs.get(index(bb));
    }

    @Override
    public boolean isReachableFromEntry(BasicBlock bb) {
        return reachable[index(bb)];
    }

    @Override
    public boolean dominates(BasicBlock a, BasicBlock b) {
        int aNum = index(a);
        int bNum = index(b);
        if (aNum == bNum) {
            return true;
        }
        if (!reachable[aNum] || !reachable[bNum]) {
            return false;
        }
        for (int current = idom[bNum]; current >= 0; current = idom[current]) {
            if (current == aNum) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Collection<ConditionalBranchInstruction> getConditionalBranches() {
        return branches;
    }

    @Override
    public Collection<ConditionalBranchInstruction> getBranchesFor(Instruction condition) {
        List<ConditionalBranchInstruction> brs = branchesByCondition.get(condition);
        if (brs == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(brs);
    }

    @Override
    public List<SourceCondition> getSourceConditions() {
        return sourceConditions;
    }

    @Override
    public Iterator<BasicBlock> iterator() {
        return blocks.iterator();
    }

    /**
     * Get the index for a block, making sure it belongs to this graph
     *
     * @param bb
     *            basic block
     * @return block number
     */
    private int index(BasicBlock bb) {
        int num = bb.getNumber();
        if (num < 0 || num >= blocks.size() || blocks.get(num) != bb) {
            throw new IllegalArgumentException(bb + " is not a basic block of " + name);
        }
        return num;
    }

    @Override
    public String toString() {
        return "CFG for " + name + " (" + blocks.size() + " blocks)";
    }
}
