package analysis.guards;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.BinaryOpInstruction;
import analysis.guards.cfg.CompareInstruction;
import analysis.guards.cfg.ControlFlowGraphBuilder;
import analysis.guards.cfg.Instruction;
import analysis.guards.cfg.ValueInstruction;

public class TestComparisonNormalForm extends TestCase {

    private ControlFlowGraphBuilder builder;
    private BasicBlock bb;
    private ValueInstruction l;
    private ValueInstruction r;

    @Override
    protected void setUp() {
        builder = new ControlFlowGraphBuilder("normal");
        bb = builder.newBlock();
        l = builder.value(bb, "L");
        r = builder.value(bb, "R");
    }

    private NormalizedComparison normalizeOnly(CompareInstruction.Operator op) {
        List<NormalizedComparison> ncs = ComparisonNormalForm.normalize(builder.compare(bb, op, l, r));
        assertEquals(1, ncs.size());
        return ncs.get(0);
    }

    private static void assertNormalized(NormalizedComparison nc, Instruction left, Instruction right, long k,
                                         Relation relation, boolean value) {
        assertSame(nc.toString(), left, nc.getLeft());
        assertSame(nc.toString(), right, nc.getRight());
        assertEquals(nc.toString(), k, nc.getK());
        assertEquals(nc.toString(), relation, nc.getRelation());
        assertEquals(nc.toString(), value, nc.getValue());
    }

    public void testTable() {
        assertNormalized(normalizeOnly(CompareInstruction.Operator.LT), l, r, 0, Relation.LT, true);
        assertNormalized(normalizeOnly(CompareInstruction.Operator.LE), l, r, 1, Relation.LT, true);
        assertNormalized(normalizeOnly(CompareInstruction.Operator.GT), r, l, 0, Relation.LT, true);
        assertNormalized(normalizeOnly(CompareInstruction.Operator.GE), r, l, 1, Relation.LT, true);
        assertNormalized(normalizeOnly(CompareInstruction.Operator.EQ), l, r, 0, Relation.EQ, true);
        assertNormalized(normalizeOnly(CompareInstruction.Operator.NE), l, r, 0, Relation.EQ, false);
    }

    public void testNotAComparison() {
        assertTrue(ComparisonNormalForm.normalize(l).isEmpty());
        BinaryOpInstruction sum = builder.binaryOp(bb, BinaryOpInstruction.Operator.ADD, l, r);
        assertTrue(ComparisonNormalForm.normalize(sum).isEmpty());
        assertTrue(ComparisonNormalForm.normalize(builder.not(bb, sum)).isEmpty());
    }

    /**
     * Evaluating the normal form on concrete values gives the same result as the raw comparison
     */
    public void testRoundTrip() {
        for (CompareInstruction.Operator op : CompareInstruction.Operator.values()) {
            NormalizedComparison nc = normalizeOnly(op);
            for (long a = -4; a <= 4; a++) {
                for (long b = -4; b <= 4; b++) {
                    Map<Instruction, Long> values = new HashMap<>();
                    values.put(l, a);
                    values.put(r, b);
                    boolean normalized = nc.evaluate(values.get(nc.getLeft()), values.get(nc.getRight()));
                    assertEquals(op + " on " + a + ", " + b, op.evaluate(a, b), normalized);
                }
            }
        }
    }

    public void testExtremeValues() {
        NormalizedComparison le = normalizeOnly(CompareInstruction.Operator.LE);
        // L <= R with R at the maximum: R + 1 does not fit but the comparison is still true
        assertTrue(le.evaluate(Long.MAX_VALUE, Long.MAX_VALUE));
        assertTrue(le.evaluate(Long.MIN_VALUE, Long.MAX_VALUE));
        assertFalse(le.evaluate(Long.MAX_VALUE, Long.MIN_VALUE));
    }
}
