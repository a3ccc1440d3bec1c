package analysis.guards;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.guards.cfg.ConditionalBranchInstruction;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.cfg.Instruction;
import analysis.guards.cfg.SourceCondition;

/**
 * Finds the guard conditions of a control flow graph, once, and gives each one its variant. Every instruction used as
 * the condition of a conditional branch becomes a {@link DirectCondition}. Every source condition recorded by the front
 * end becomes a {@link LogicalCombinator} or {@link SyntacticNot} tree whose leaves are direct conditions.
 * <p>
 * A source condition with a leaf that is not the condition of any branch cannot be related to the control flow and
 * is dropped.
 */
public class GuardConditionNormalizer {

    private final ControlFlowGraph cfg;
    /**
     * Direct condition for each branch condition instruction
     */
    private final Map<Instruction, DirectCondition> direct = new LinkedHashMap<>();
    /**
     * Guard condition for each source condition (sub-conditions included) that could be normalized
     */
    private final Map<SourceCondition, GuardCondition> fromSource = new IdentityHashMap<>();
    /**
     * All guard conditions, each equal condition appears once
     */
    private final Set<GuardCondition> all = new LinkedHashSet<>();
    /**
     * Level of output, higher means more is printed
     */
    private final int outputLevel;

    /**
     * Normalize the guard conditions of the given control flow graph
     *
     * @param cfg
     *            control flow graph
     * @param outputLevel
     *            level of output, higher means more is printed
     */
    public GuardConditionNormalizer(ControlFlowGraph cfg, int outputLevel) {
        this.cfg = cfg;
        this.outputLevel = outputLevel;
        for (ConditionalBranchInstruction br : cfg.getConditionalBranches()) {
            Instruction condition = br.getCondition();
            if (condition == null) {
                if (outputLevel >= 1) {
                    System.err.println("WARNING: no condition for branch in " + br.getBasicBlock() + " of "
                            + cfg.getName());
                }
                continue;
            }
            if (!direct.containsKey(condition)) {
                DirectCondition dc = new DirectCondition(condition);
                direct.put(condition, dc);
                all.add(dc);
            }
        }
        for (SourceCondition sc : cfg.getSourceConditions()) {
            GuardCondition gc = normalize(sc);
            if (gc == null && outputLevel >= 1) {
                System.err.println("WARNING: source condition " + sc + " in " + cfg.getName()
                        + " is not made of branch conditions, ignoring it");
            }
        }
    }

    /**
     * Compute the guard condition for a source condition and its sub-conditions
     *
     * @param sc
     *            source condition
     * @return guard condition, null if a leaf is not a branch condition
     */
    private GuardCondition normalize(SourceCondition sc) {
        if (fromSource.containsKey(sc)) {
            return fromSource.get(sc);
        }
        GuardCondition gc;
        switch (sc.getKind()) {
        case INSTRUCTION:
            gc = direct.get(sc.getInstruction());
            break;
        case NOT:
            GuardCondition inner = normalize(sc.getLeft());
            gc = inner == null ? null : new SyntacticNot(inner);
            break;
        case AND:
        case OR:
            GuardCondition left = normalize(sc.getLeft());
            GuardCondition right = normalize(sc.getRight());
            LogicalOperator op = sc.getKind() == SourceCondition.Kind.AND ? LogicalOperator.AND : LogicalOperator.OR;
            gc = left == null || right == null ? null : new LogicalCombinator(op, left, right);
            break;
        default:
            throw new IllegalStateException("Unknown source condition kind " + sc.getKind());
        }
        fromSource.put(sc, gc);
        if (gc != null) {
            if (all.add(gc) && outputLevel >= 2) {
                System.err.println("GUARD " + gc + " from " + sc + " in " + cfg.getName());
            }
        }
        return gc;
    }

    /**
     * All guard conditions of the control flow graph
     *
     * @return unmodifiable collection of guard conditions, direct conditions first
     */
    public Collection<GuardCondition> getGuardConditions() {
        return Collections.unmodifiableSet(all);
    }

    /**
     * Guard condition for an instruction branched on
     *
     * @param condition
     *            condition instruction
     * @return direct condition, null if no branch uses <code>condition</code>
     */
    public DirectCondition getDirectCondition(Instruction condition) {
        return direct.get(condition);
    }

    /**
     * Guard condition for a source condition recorded by the front end (or one of its sub-conditions)
     *
     * @param sc
     *            source condition
     * @return guard condition, null if it could not be normalized
     */
    public GuardCondition getGuardCondition(SourceCondition sc) {
        return fromSource.get(sc);
    }

    /**
     * Direct conditions in the order their branches appear
     *
     * @return direct conditions
     */
    public List<DirectCondition> getDirectConditions() {
        return new ArrayList<>(direct.values());
    }
}
