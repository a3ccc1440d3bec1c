package analysis.guards;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import util.WorkQueue;
import analysis.guards.cfg.BinaryOpInstruction;
import analysis.guards.cfg.ConstantInstruction;
import analysis.guards.cfg.Instruction;
import analysis.guards.cfg.LogicalNotInstruction;

/**
 * Derives the comparison facts implied by the truth value of an instruction. Starting from the normal form of a
 * comparison the following rewrites are closed over:
 *
 * <pre>
 *   (l &lt; r + k) is v            =&gt;  (r &lt; l + (1-k)) is !v
 *   (l == r + k) is v           =&gt;  (r == l - k) is v
 *   l = a - x                   =&gt;  a REL r + (k+x)
 *   r = b - x                   =&gt;  l REL b + (k-x)
 *   l = a + x  or  x + a        =&gt;  a REL r + (k-x)
 *   r = b + x  or  x + b        =&gt;  l REL b + (k+x)
 * </pre>
 *
 * where <code>x</code> is an integer constant. A logical not instruction has the facts of its operand with the truth
 * value of the test flipped.
 * <p>
 * Every rewrite either swaps the operands or replaces one of them by one of its own operands. Operands are created
 * before their uses, so only finitely many facts can be reached and the closure terminates. Constant arithmetic is
 * checked; a rewrite that would overflow is not applied.
 * <p>
 * Results are cached per instruction and are safe to compute from several threads.
 */
public class ComparisonPropagation {

    /**
     * Facts already computed for each test instruction
     */
    private final ConcurrentMap<Instruction, Set<ComparisonFact>> cache = new ConcurrentHashMap<>();
    /**
     * Level of output, higher means more is printed
     */
    private int outputLevel = 0;

    /**
     * Get the facts implied by the truth value of an instruction
     *
     * @param test
     *            instruction computing a boolean
     * @return unmodifiable set of facts, each stated in terms of the truth value of <code>test</code>
     */
    public Set<ComparisonFact> getFacts(Instruction test) {
        Set<ComparisonFact> facts = cache.get(test);
        if (facts != null) {
            return facts;
        }
        facts = Collections.unmodifiableSet(computeFacts(test));
        Set<ComparisonFact> existing = cache.putIfAbsent(test, facts);
        return existing == null ? facts : existing;
    }

    private Set<ComparisonFact> computeFacts(Instruction test) {
        if (test instanceof LogicalNotInstruction) {
            // (x is t => F) => (!x is !t => F)
            Set<ComparisonFact> facts = new LinkedHashSet<>();
            for (ComparisonFact f : getFacts(((LogicalNotInstruction) test).getOperand())) {
                facts.add(f.withTestIsTrue(!f.getTestIsTrue()));
            }
            return facts;
        }

        WorkQueue<ComparisonFact> q = new WorkQueue<>();
        for (NormalizedComparison nc : ComparisonNormalForm.normalize(test)) {
            addBaseFacts(nc, q);
        }
        while (!q.isEmpty()) {
            ComparisonFact f = q.poll();
            if (f.getRelation() == Relation.LT) {
                // (l < r + k) is v => (r < l + (1-k)) is !v
                Long dual = subtract(1, f.getK());
                if (dual != null) {
                    q.add(new ComparisonFact(f.getTestIsTrue(),
                                             f.getRight(),
                                             f.getLeft(),
                                             dual,
                                             Relation.LT,
                                             !f.getValue()));
                }
            }
            else {
                // (l == r + k) is v => (r == l - k) is v
                Long negated = subtract(0, f.getK());
                if (negated != null) {
                    q.add(new ComparisonFact(f.getTestIsTrue(),
                                             f.getRight(),
                                             f.getLeft(),
                                             negated,
                                             Relation.EQ,
                                             f.getValue()));
                }
            }
            absorbLeft(f, q);
            absorbRight(f, q);
        }

        Set<ComparisonFact> facts = q.getAllAdded();
        if (outputLevel >= 2) {
            System.err.println("COMPARISONS for " + test + ": " + facts.size());
            if (outputLevel >= 3) {
                for (ComparisonFact f : facts) {
                    System.err.println("\t" + f);
                }
            }
        }
        return facts;
    }

    /**
     * Add the facts for the comparison itself. This is the only place where the truth value of the test is related
     * to the value of a comparison, the case split keeps the two from being confused anywhere else.
     */
    private static void addBaseFacts(NormalizedComparison nc, WorkQueue<ComparisonFact> q) {
        if (nc.getRelation() == Relation.LT) {
            // test is t => (l < r + k) is t
            q.add(new ComparisonFact(true, nc.getLeft(), nc.getRight(), nc.getK(), Relation.LT, nc.getValue()));
            q.add(new ComparisonFact(false, nc.getLeft(), nc.getRight(), nc.getK(), Relation.LT, !nc.getValue()));
        }
        else {
            // test is v => (l == r + k) holds
            // test is !v => (l == r + k) does not hold
            q.add(new ComparisonFact(nc.getValue(), nc.getLeft(), nc.getRight(), nc.getK(), Relation.EQ, true));
            q.add(new ComparisonFact(!nc.getValue(), nc.getLeft(), nc.getRight(), nc.getK(), Relation.EQ, false));
        }
    }

    /**
     * Look through a constant added to or subtracted from the left operand of a fact
     */
    private static void absorbLeft(ComparisonFact f, WorkQueue<ComparisonFact> q) {
        if (!(f.getLeft() instanceof BinaryOpInstruction)) {
            return;
        }
        BinaryOpInstruction lhs = (BinaryOpInstruction) f.getLeft();
        switch (lhs.getOperator()) {
        case SUB:
            // a - x REL r + c => a REL r + (c+x)
            if (lhs.getRight() instanceof ConstantInstruction) {
                long x = ((ConstantInstruction) lhs.getRight()).getValue();
                addShifted(f, lhs.getLeft(), f.getRight(), add(f.getK(), x), q);
            }
            break;
        case ADD:
            // a + x REL r + c => a REL r + (c-x)
            if (lhs.getRight() instanceof ConstantInstruction) {
                long x = ((ConstantInstruction) lhs.getRight()).getValue();
                addShifted(f, lhs.getLeft(), f.getRight(), subtract(f.getK(), x), q);
            }
            // x + a REL r + c => a REL r + (c-x)
            if (lhs.getLeft() instanceof ConstantInstruction) {
                long x = ((ConstantInstruction) lhs.getLeft()).getValue();
                addShifted(f, lhs.getRight(), f.getRight(), subtract(f.getK(), x), q);
            }
            break;
        default:
            break;
        }
    }

    /**
     * Look through a constant added to or subtracted from the right operand of a fact
     */
    private static void absorbRight(ComparisonFact f, WorkQueue<ComparisonFact> q) {
        if (!(f.getRight() instanceof BinaryOpInstruction)) {
            return;
        }
        BinaryOpInstruction rhs = (BinaryOpInstruction) f.getRight();
        switch (rhs.getOperator()) {
        case SUB:
            // l REL (b - x) + c => l REL b + (c-x)
            if (rhs.getRight() instanceof ConstantInstruction) {
                long x = ((ConstantInstruction) rhs.getRight()).getValue();
                addShifted(f, f.getLeft(), rhs.getLeft(), subtract(f.getK(), x), q);
            }
            break;
        case ADD:
            // l REL (b + x) + c => l REL b + (c+x)
            if (rhs.getRight() instanceof ConstantInstruction) {
                long x = ((ConstantInstruction) rhs.getRight()).getValue();
                addShifted(f, f.getLeft(), rhs.getLeft(), add(f.getK(), x), q);
            }
            // l REL (x + b) + c => l REL b + (c+x)
            if (rhs.getLeft() instanceof ConstantInstruction) {
                long x = ((ConstantInstruction) rhs.getLeft()).getValue();
                addShifted(f, f.getLeft(), rhs.getRight(), add(f.getK(), x), q);
            }
            break;
        default:
            break;
        }
    }

    private static void addShifted(ComparisonFact f, Instruction left, Instruction right, Long k,
                                   WorkQueue<ComparisonFact> q) {
        if (k == null) {
            // the new offset does not fit
            return;
        }
        q.add(new ComparisonFact(f.getTestIsTrue(), left, right, k, f.getRelation(), f.getValue()));
    }

    /**
     * @return a + b, or null if that overflows
     */
    static Long add(long a, long b) {
        long r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return null;
        }
        return r;
    }

    /**
     * @return a - b, or null if that overflows
     */
    static Long subtract(long a, long b) {
        long r = a - b;
        if (((a ^ b) & (a ^ r)) < 0) {
            return null;
        }
        return r;
    }

    /**
     * Set the level of output
     *
     * @param level
     *            level of the output, higher means more output
     */
    public void setOutputLevel(int level) {
        this.outputLevel = level;
    }
}
