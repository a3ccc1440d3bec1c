package analysis.guards;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.cfg.Instruction;
import analysis.guards.cfg.SourceCondition;

/**
 * Guard analysis of one control flow graph. This is the interface used by clients:
 * <ul>
 * <li>{@link #controls(GuardCondition, BasicBlock, boolean)} - the block can only be reached if the condition
 * evaluated to the given truth value</li>
 * <li>{@link #comparesLt} / {@link #comparesEq} - if the condition evaluates to the given truth value then
 * <code>left &lt; right + k</code> (resp. <code>left == right + k</code>) has the given value</li>
 * <li>{@link #ensuresLt} / {@link #ensuresEq} - <code>left &lt; right + k</code> (resp. <code>left == right + k</code>)
 * has the given value everywhere in the block because of the condition</li>
 * </ul>
 * Each predicate also has an enumerating form.
 * <p>
 * All results are functions of the (immutable) graph. They are computed on demand and cached for the lifetime of
 * the session; the caches are concurrent maps and the session may be queried from several threads at once. Two threads
 * asking for the same result at the same time may both compute it, the first one stored is kept.
 */
public class GuardAnalysisSession {

    private final ControlFlowGraph cfg;
    private final GuardConditionNormalizer conditions;
    private final ControlsEngine controlsEngine;
    private final ComparisonPropagation propagation;
    /**
     * Blocks controlled by a guard condition for the "true" edge(s)
     */
    private final ConcurrentMap<GuardCondition, Set<BasicBlock>> controlledIfTrue = new ConcurrentHashMap<>();
    /**
     * Blocks controlled by a guard condition for the "false" edge(s)
     */
    private final ConcurrentMap<GuardCondition, Set<BasicBlock>> controlledIfFalse = new ConcurrentHashMap<>();
    /**
     * Comparison facts implied by a guard condition
     */
    private final ConcurrentMap<GuardCondition, Set<ComparisonFact>> comparisons = new ConcurrentHashMap<>();
    /**
     * Level of output, higher means more is printed
     */
    private final int outputLevel;

    /**
     * Start analyzing the given control flow graph
     *
     * @param cfg
     *            control flow graph, must not change during the session
     */
    public GuardAnalysisSession(ControlFlowGraph cfg) {
        this(cfg, 0);
    }

    /**
     * Start analyzing the given control flow graph
     *
     * @param cfg
     *            control flow graph, must not change during the session
     * @param outputLevel
     *            level of output, higher means more is printed to the console
     */
    public GuardAnalysisSession(ControlFlowGraph cfg, int outputLevel) {
        this.cfg = cfg;
        this.outputLevel = outputLevel;
        this.conditions = new GuardConditionNormalizer(cfg, outputLevel);
        this.controlsEngine = new ControlsEngine(cfg, this);
        this.propagation = new ComparisonPropagation();
        this.propagation.setOutputLevel(outputLevel);
        if (outputLevel >= 1) {
            System.err.println("GUARDS for " + cfg.getName() + ": " + conditions.getGuardConditions().size());
        }
    }

    public ControlFlowGraph getControlFlowGraph() {
        return cfg;
    }

    /**
     * All guard conditions of the control flow graph
     *
     * @return unmodifiable collection of guard conditions
     */
    public Collection<GuardCondition> getGuardConditions() {
        return conditions.getGuardConditions();
    }

    /**
     * Guard condition for an instruction used as the condition of a branch
     *
     * @param condition
     *            instruction branched on
     * @return the guard condition, null if no branch uses the instruction
     */
    public GuardCondition getGuardCondition(Instruction condition) {
        return conditions.getDirectCondition(condition);
    }

    /**
     * Guard condition for a source condition recorded by the front end
     *
     * @param sc
     *            source condition (or a sub-condition of a recorded one)
     * @return the guard condition, null if it could not be related to the control flow
     */
    public GuardCondition getGuardCondition(SourceCondition sc) {
        return conditions.getGuardCondition(sc);
    }

    /**
     * Whether <code>block</code> can only be reached if <code>cond</code> evaluated to <code>testIsTrue</code>
     *
     * @param cond
     *            guard condition
     * @param block
     *            basic block
     * @param testIsTrue
     *            truth value of the condition
     * @return true if the condition controls the block for the truth value
     */
    public boolean controls(GuardCondition cond, BasicBlock block, boolean testIsTrue) {
        return getControlledBlocks(cond, testIsTrue).contains(block);
    }

    /**
     * All blocks <code>cond</code> controls for <code>testIsTrue</code>
     *
     * @param cond
     *            guard condition
     * @param testIsTrue
     *            truth value of the condition
     * @return unmodifiable set of controlled blocks
     */
    public Set<BasicBlock> getControlledBlocks(GuardCondition cond, boolean testIsTrue) {
        ConcurrentMap<GuardCondition, Set<BasicBlock>> cache = testIsTrue ? controlledIfTrue : controlledIfFalse;
        Set<BasicBlock> controlled = cache.get(cond);
        if (controlled != null) {
            return controlled;
        }
        // Not computeIfAbsent: computing a compound condition reads the cache for its operands
        controlled = Collections.unmodifiableSet(controlsEngine.computeControlledBlocks(cond, testIsTrue));
        Set<BasicBlock> existing = cache.putIfAbsent(cond, controlled);
        if (existing != null) {
            return existing;
        }
        if (outputLevel >= 3) {
            System.err.println("CONTROLS " + cond + " is " + testIsTrue + ": " + controlled);
        }
        return controlled;
    }

    /**
     * All comparison facts implied by the truth value of a guard condition. This enumerates the tuples of
     * {@link #comparesLt} (facts with relation {@link Relation#LT}) and {@link #comparesEq} (facts with relation
     * {@link Relation#EQ}).
     *
     * @param cond
     *            guard condition
     * @return unmodifiable set of facts
     */
    public Set<ComparisonFact> getComparisons(GuardCondition cond) {
        Set<ComparisonFact> facts = comparisons.get(cond);
        if (facts != null) {
            return facts;
        }
        facts = Collections.unmodifiableSet(computeComparisons(cond));
        Set<ComparisonFact> existing = comparisons.putIfAbsent(cond, facts);
        return existing == null ? facts : existing;
    }

    private Set<ComparisonFact> computeComparisons(GuardCondition cond) {
        Set<ComparisonFact> facts = new LinkedHashSet<>();
        switch (cond.getKind()) {
        case DIRECT:
            facts.addAll(propagation.getFacts(((DirectCondition) cond).getInstruction()));
            break;
        case SYNTACTIC_NOT:
            for (ComparisonFact f : getComparisons(((SyntacticNot) cond).getInner())) {
                facts.add(f.withTestIsTrue(!f.getTestIsTrue()));
            }
            break;
        case LOGICAL_COMBINATOR:
            // Forward the facts of an operand whose value is implied by the value of the whole. There is no
            // separate derivation for the compound itself, so facts that only follow from combining both operands
            // (e.g. x < y || x == y implying x <= y) are not found.
            LogicalCombinator lc = (LogicalCombinator) cond;
            for (boolean wholeIsTrue : new boolean[] { true, false }) {
                for (boolean leftOperand : new boolean[] { true, false }) {
                    Boolean partIsTrue = lc.getOperator().impliedOperandValue(leftOperand, wholeIsTrue);
                    if (partIsTrue == null) {
                        continue;
                    }
                    for (ComparisonFact f : getComparisons(lc.getOperand(leftOperand))) {
                        if (f.getTestIsTrue() == partIsTrue) {
                            facts.add(f.withTestIsTrue(wholeIsTrue));
                        }
                    }
                }
            }
            break;
        default:
            throw new IllegalStateException("Unknown guard condition kind " + cond.getKind());
        }
        Set<ComparisonFact> consistent = ComparisonFact.removeUnsatisfiable(facts);
        if (consistent.size() != facts.size() && outputLevel >= 2) {
            System.err.println("UNSATISFIABLE truth value for " + cond + " in " + cfg.getName()
                    + ", dropped " + (facts.size() - consistent.size()) + " facts");
        }
        return consistent;
    }

    /**
     * If <code>cond</code> evaluates to <code>testIsTrue</code> then <code>left &lt; right + k</code> evaluates to
     * <code>isLt</code>
     *
     * @param cond
     *            guard condition
     * @param left
     *            left operand
     * @param right
     *            right operand
     * @param k
     *            constant offset
     * @param isLt
     *            value of the comparison
     * @param testIsTrue
     *            truth value of the condition
     * @return true if the implication can be derived
     */
    public boolean comparesLt(GuardCondition cond, Instruction left, Instruction right, long k, boolean isLt,
                              boolean testIsTrue) {
        return getComparisons(cond).contains(new ComparisonFact(testIsTrue, left, right, k, Relation.LT, isLt));
    }

    /**
     * If <code>cond</code> evaluates to <code>testIsTrue</code> then <code>left == right + k</code> evaluates to
     * <code>areEqual</code>
     *
     * @param cond
     *            guard condition
     * @param left
     *            left operand
     * @param right
     *            right operand
     * @param k
     *            constant offset
     * @param areEqual
     *            value of the comparison
     * @param testIsTrue
     *            truth value of the condition
     * @return true if the implication can be derived
     */
    public boolean comparesEq(GuardCondition cond, Instruction left, Instruction right, long k, boolean areEqual,
                              boolean testIsTrue) {
        return getComparisons(cond).contains(new ComparisonFact(testIsTrue, left, right, k, Relation.EQ, areEqual));
    }

    /**
     * <code>left &lt; right + k</code> evaluates to <code>isLt</code> on every execution reaching <code>block</code>,
     * because <code>cond</code> controls the block
     *
     * @param cond
     *            guard condition
     * @param left
     *            left operand
     * @param right
     *            right operand
     * @param k
     *            constant offset
     * @param block
     *            basic block
     * @param isLt
     *            value of the comparison
     * @return true if there is a truth value of <code>cond</code> that controls the block and implies the comparison
     */
    public boolean ensuresLt(GuardCondition cond, Instruction left, Instruction right, long k, BasicBlock block,
                             boolean isLt) {
        for (boolean testIsTrue : new boolean[] { true, false }) {
            if (comparesLt(cond, left, right, k, isLt, testIsTrue) && controls(cond, block, testIsTrue)) {
                return true;
            }
        }
        return false;
    }

    /**
     * <code>left == right + k</code> evaluates to <code>areEqual</code> on every execution reaching
     * <code>block</code>, because <code>cond</code> controls the block
     *
     * @param cond
     *            guard condition
     * @param left
     *            left operand
     * @param right
     *            right operand
     * @param k
     *            constant offset
     * @param block
     *            basic block
     * @param areEqual
     *            value of the comparison
     * @return true if there is a truth value of <code>cond</code> that controls the block and implies the comparison
     */
    public boolean ensuresEq(GuardCondition cond, Instruction left, Instruction right, long k, BasicBlock block,
                             boolean areEqual) {
        for (boolean testIsTrue : new boolean[] { true, false }) {
            if (comparesEq(cond, left, right, k, areEqual, testIsTrue) && controls(cond, block, testIsTrue)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Facts a guard condition ensures in a block. Each returned fact keeps the truth value of the condition that
     * controls the block.
     *
     * @param cond
     *            guard condition
     * @param block
     *            basic block
     * @return new set of the facts of <code>cond</code> whose truth value controls <code>block</code>
     */
    public Set<ComparisonFact> getEnsuredFacts(GuardCondition cond, BasicBlock block) {
        Set<ComparisonFact> ensured = new LinkedHashSet<>();
        for (ComparisonFact f : getComparisons(cond)) {
            if (controls(cond, block, f.getTestIsTrue())) {
                ensured.add(f);
            }
        }
        return ensured;
    }

    /**
     * Facts any guard condition of the graph ensures in a block
     *
     * @param block
     *            basic block
     * @return new set of ensured facts
     */
    public Set<ComparisonFact> getEnsuredFacts(BasicBlock block) {
        Set<ComparisonFact> ensured = new LinkedHashSet<>();
        for (GuardCondition cond : getGuardConditions()) {
            ensured.addAll(getEnsuredFacts(cond, block));
        }
        return ensured;
    }
}
