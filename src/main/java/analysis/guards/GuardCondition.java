package analysis.guards;

/**
 * Expression whose truth value decides which way a function's control flow goes. Guard conditions come in three
 * variants, distinguished by {@link #getKind()}:
 * <ul>
 * <li>{@link DirectCondition} - an instruction that is the condition of a conditional branch</li>
 * <li>{@link LogicalCombinator} - a short-circuit <code>&amp;&amp;</code> or <code>||</code> that the IR lowered
 * into several branches</li>
 * <li>{@link SyntacticNot} - a <code>!</code> that the IR eliminated by swapping branch targets</li>
 * </ul>
 * Guard conditions are created by {@link GuardConditionNormalizer} and queried through a
 * {@link GuardAnalysisSession}.
 */
public abstract class GuardCondition {

    /**
     * Variant tag
     */
    public enum Kind {
        DIRECT, LOGICAL_COMBINATOR, SYNTACTIC_NOT
    }

    /**
     * Which variant this is
     *
     * @return variant tag
     */
    public abstract Kind getKind();
}
