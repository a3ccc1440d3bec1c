package analysis.guards.cfg;

import java.util.ArrayList;
import java.util.List;

import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;

/**
 * Builds a {@link ControlFlowGraph}. The first block created is the entry. Operands must be created before the
 * instructions that use them, so the operand graph is acyclic. A conditional branch must be the last instruction of
 * its block and adds the edges to both of its targets; other edges are added with
 * {@link #addEdge(BasicBlock, BasicBlock)}.
 * <p>
 * A builder can only be built once.
 */
public class ControlFlowGraphBuilder {

    private final String name;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final SlowSparseNumberedGraph<BasicBlock> graph = SlowSparseNumberedGraph.make();
    private final List<SourceCondition> sourceConditions = new ArrayList<>();
    /**
     * Next value number to hand out, 0 is never used
     */
    private int nextValueNumber = 1;
    private boolean built = false;

    /**
     * Create a builder for the graph of a function
     *
     * @param name
     *            name of the function
     */
    public ControlFlowGraphBuilder(String name) {
        this.name = name;
    }

    /**
     * Create a new empty basic block, the first one is the entry
     *
     * @return new basic block
     */
    public BasicBlock newBlock() {
        checkNotBuilt();
        BasicBlock bb = new BasicBlock(blocks.size(), this);
        blocks.add(bb);
        graph.addNode(bb);
        return bb;
    }

    /**
     * Add an opaque value (parameter, load, phi, ...)
     *
     * @param bb
     *            block containing the definition
     * @param varName
     *            source name of the value, may be null
     * @return new instruction
     */
    public ValueInstruction value(BasicBlock bb, String varName) {
        return append(new ValueInstruction(nextValueNumber(), checkBlock(bb), varName));
    }

    /**
     * Add an integer literal
     *
     * @param bb
     *            block containing the constant
     * @param value
     *            literal value
     * @return new instruction
     */
    public ConstantInstruction constant(BasicBlock bb, long value) {
        return append(new ConstantInstruction(nextValueNumber(), checkBlock(bb), value));
    }

    public BinaryOpInstruction binaryOp(BasicBlock bb, BinaryOpInstruction.Operator op, Instruction left,
                                        Instruction right) {
        checkOperand(left);
        checkOperand(right);
        return append(new BinaryOpInstruction(nextValueNumber(), checkBlock(bb), checkNotNull(op), left, right));
    }

    public CompareInstruction compare(BasicBlock bb, CompareInstruction.Operator op, Instruction left,
                                      Instruction right) {
        checkOperand(left);
        checkOperand(right);
        return append(new CompareInstruction(nextValueNumber(), checkBlock(bb), checkNotNull(op), left, right));
    }

    public LogicalNotInstruction not(BasicBlock bb, Instruction operand) {
        checkOperand(operand);
        return append(new LogicalNotInstruction(nextValueNumber(), checkBlock(bb), operand));
    }

    /**
     * End a basic block with a conditional branch
     *
     * @param bb
     *            block ended by the branch
     * @param condition
     *            condition branched on, null if the front end could not determine it
     * @param trueTarget
     *            successor when the condition is true
     * @param falseTarget
     *            successor when the condition is false
     * @return new branch instruction
     */
    public ConditionalBranchInstruction branch(BasicBlock bb, Instruction condition, BasicBlock trueTarget,
                                               BasicBlock falseTarget) {
        if (condition != null) {
            checkOperand(condition);
        }
        checkBlock(trueTarget);
        checkBlock(falseTarget);
        ConditionalBranchInstruction br = append(new ConditionalBranchInstruction(nextValueNumber(),
                                                                                  checkBlock(bb),
                                                                                  condition,
                                                                                  trueTarget,
                                                                                  falseTarget));
        graph.addEdge(bb, trueTarget);
        graph.addEdge(bb, falseTarget);
        return br;
    }

    /**
     * Add an unconditional edge (goto or fall through)
     *
     * @param from
     *            source block
     * @param to
     *            target block
     */
    public void addEdge(BasicBlock from, BasicBlock to) {
        checkBlock(to);
        if (checkBlock(from).getLastInstruction() instanceof ConditionalBranchInstruction) {
            throw new IllegalStateException(from + " ends in a conditional branch, cannot add an edge to " + to);
        }
        graph.addEdge(from, to);
    }

    /**
     * Record a source-level condition whose logical operators were lowered into branches
     *
     * @param c
     *            source condition
     * @return the same condition
     */
    public SourceCondition addSourceCondition(SourceCondition c) {
        checkNotBuilt();
        checkSourceCondition(c);
        sourceConditions.add(c);
        return c;
    }

    /**
     * Create the immutable control flow graph
     *
     * @return control flow graph with all the blocks created by this builder
     */
    public ControlFlowGraph build() {
        checkNotBuilt();
        if (blocks.isEmpty()) {
            throw new IllegalStateException("No basic blocks in " + name);
        }
        built = true;
        for (BasicBlock bb : blocks) {
            bb.seal();
        }
        return new ImmutableControlFlowGraph(name, blocks, graph, sourceConditions);
    }

    private int nextValueNumber() {
        return nextValueNumber++;
    }

    private <I extends Instruction> I append(I i) {
        BasicBlock bb = i.getBasicBlock();
        if (bb.getLastInstruction() instanceof ConditionalBranchInstruction) {
            throw new IllegalStateException("Cannot add " + i + " after the branch ending " + bb);
        }
        bb.append(i);
        return i;
    }

    private BasicBlock checkBlock(BasicBlock bb) {
        checkNotBuilt();
        if (bb == null) {
            throw new IllegalArgumentException("null basic block in " + name);
        }
        if (bb.getOwner() != this) {
            throw new IllegalArgumentException(bb + " was not created by the builder for " + name);
        }
        return bb;
    }

    private void checkOperand(Instruction i) {
        if (i == null) {
            throw new IllegalArgumentException("null operand in " + name);
        }
        checkBlock(i.getBasicBlock());
        if (i instanceof ConditionalBranchInstruction) {
            throw new IllegalArgumentException("A branch cannot be used as an operand: " + i);
        }
    }

    private void checkSourceCondition(SourceCondition c) {
        if (c.getKind() == SourceCondition.Kind.INSTRUCTION) {
            checkOperand(c.getInstruction());
            return;
        }
        checkSourceCondition(c.getLeft());
        if (c.getRight() != null) {
            checkSourceCondition(c.getRight());
        }
    }

    private static <T> T checkNotNull(T op) {
        if (op == null) {
            throw new IllegalArgumentException("null operator");
        }
        return op;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("The graph for " + name + " has already been built");
        }
    }
}
