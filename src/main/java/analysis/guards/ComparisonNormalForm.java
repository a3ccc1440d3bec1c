package analysis.guards;

import java.util.Collections;
import java.util.List;

import analysis.guards.cfg.CompareInstruction;
import analysis.guards.cfg.Instruction;

/**
 * Rewrites raw comparisons into normal form
 *
 * <pre>
 *   l &lt; r    =&gt;   l &lt; r + 0        value true
 *   l &lt;= r   =&gt;   l &lt; r + 1        value true
 *   l &gt; r    =&gt;   r &lt; l + 0        value true
 *   l &gt;= r   =&gt;   r &lt; l + 1        value true
 *   l == r   =&gt;   l == r + 0       value true
 *   l != r   =&gt;   l == r + 0       value false
 * </pre>
 */
public final class ComparisonNormalForm {

    private ComparisonNormalForm() {
        // static utility
    }

    /**
     * Normalize the comparison computed by an instruction
     *
     * @param i
     *            any instruction
     * @return normalized comparisons for <code>i</code>, empty if <code>i</code> is not a comparison
     */
    public static List<NormalizedComparison> normalize(Instruction i) {
        if (!(i instanceof CompareInstruction)) {
            return Collections.emptyList();
        }
        CompareInstruction cmp = (CompareInstruction) i;
        Instruction l = cmp.getLeft();
        Instruction r = cmp.getRight();
        NormalizedComparison nc;
        switch (cmp.getOperator()) {
        case LT:
            nc = new NormalizedComparison(l, r, 0, Relation.LT, true);
            break;
        case LE:
            nc = new NormalizedComparison(l, r, 1, Relation.LT, true);
            break;
        case GT:
            nc = new NormalizedComparison(r, l, 0, Relation.LT, true);
            break;
        case GE:
            nc = new NormalizedComparison(r, l, 1, Relation.LT, true);
            break;
        case EQ:
            nc = new NormalizedComparison(l, r, 0, Relation.EQ, true);
            break;
        case NE:
            nc = new NormalizedComparison(l, r, 0, Relation.EQ, false);
            break;
        default:
            throw new IllegalStateException("Unknown comparison operator " + cmp.getOperator());
        }
        return Collections.singletonList(nc);
    }
}
