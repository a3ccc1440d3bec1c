package analysis.guards;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import junit.framework.TestCase;
import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.BinaryOpInstruction;
import analysis.guards.cfg.CompareInstruction;
import analysis.guards.cfg.ConstantInstruction;
import analysis.guards.cfg.ControlFlowGraphBuilder;
import analysis.guards.cfg.Instruction;
import analysis.guards.cfg.LogicalNotInstruction;
import analysis.guards.cfg.ValueInstruction;

public class TestComparisonPropagation extends TestCase {

    private ControlFlowGraphBuilder builder;
    private BasicBlock bb;
    private ValueInstruction i;
    private ValueInstruction n;
    private ComparisonPropagation propagation;

    @Override
    protected void setUp() {
        builder = new ControlFlowGraphBuilder("compares");
        bb = builder.newBlock();
        i = builder.value(bb, "i");
        n = builder.value(bb, "n");
        propagation = new ComparisonPropagation();
    }

    private Instruction plus(Instruction a, long x) {
        return builder.binaryOp(bb, BinaryOpInstruction.Operator.ADD, a, builder.constant(bb, x));
    }

    private Instruction minus(Instruction a, long x) {
        return builder.binaryOp(bb, BinaryOpInstruction.Operator.SUB, a, builder.constant(bb, x));
    }

    private Instruction compare(CompareInstruction.Operator op, Instruction left, Instruction right) {
        return builder.compare(bb, op, left, right);
    }

    private static ComparisonFact lt(boolean testIsTrue, Instruction left, Instruction right, long k, boolean isLt) {
        return new ComparisonFact(testIsTrue, left, right, k, Relation.LT, isLt);
    }

    private static ComparisonFact eq(boolean testIsTrue, Instruction left, Instruction right, long k,
                                     boolean areEqual) {
        return new ComparisonFact(testIsTrue, left, right, k, Relation.EQ, areEqual);
    }

    public void testBaseLessThan() {
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.LT, i, n));
        assertTrue(facts.contains(lt(true, i, n, 0, true)));
        assertTrue(facts.contains(lt(false, i, n, 0, false)));
        // i < n is n < i + 1 being false
        assertTrue(facts.contains(lt(true, n, i, 1, false)));
        assertTrue(facts.contains(lt(false, n, i, 1, true)));
        assertEquals(4, facts.size());
    }

    public void testBaseEquals() {
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.EQ, i, n));
        assertTrue(facts.contains(eq(true, i, n, 0, true)));
        assertTrue(facts.contains(eq(false, i, n, 0, false)));
        assertTrue(facts.contains(eq(true, n, i, 0, true)));
        assertTrue(facts.contains(eq(false, n, i, 0, false)));
        assertEquals(4, facts.size());
    }

    public void testBaseNotEquals() {
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.NE, i, n));
        assertTrue(facts.contains(eq(true, i, n, 0, false)));
        assertTrue(facts.contains(eq(false, i, n, 0, true)));
        assertFalse(facts.contains(eq(true, i, n, 0, true)));
    }

    public void testGreaterOrEqual() {
        // i >= n is n < i + 1
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.GE, i, n));
        assertTrue(facts.contains(lt(true, n, i, 1, true)));
        assertTrue(facts.contains(lt(true, i, n, 0, false)));
        assertTrue(facts.contains(lt(false, i, n, 0, true)));
    }

    public void testAdditiveShift() {
        // i < n + 3
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.LT, i, plus(n, 3)));
        assertTrue(facts.contains(lt(true, i, n, 3, true)));
        assertTrue(facts.contains(lt(false, i, n, 3, false)));
        // n < i - 2 is false
        assertTrue(facts.contains(lt(true, n, i, -2, false)));
    }

    public void testConstantOnTheLeftOfAdd() {
        // i < 3 + n
        Instruction sum = builder.binaryOp(bb, BinaryOpInstruction.Operator.ADD, builder.constant(bb, 3), n);
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.LT, i, sum));
        assertTrue(facts.contains(lt(true, i, n, 3, true)));
    }

    public void testSubtractOnTheLeft() {
        // i - 3 < n
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.LT, minus(i, 3), n));
        assertTrue(facts.contains(lt(true, i, n, 3, true)));
    }

    public void testAddOnBothSides() {
        // i + 1 <= n - 2 is i < n - 2
        Instruction test = compare(CompareInstruction.Operator.LE, plus(i, 1), minus(n, 2));
        Set<ComparisonFact> facts = propagation.getFacts(test);
        assertTrue(facts.contains(lt(true, i, n, -2, true)));
        assertTrue(facts.contains(lt(false, i, n, -2, false)));
    }

    public void testEqualsShift() {
        // i == n + 2
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.EQ, i, plus(n, 2)));
        assertTrue(facts.contains(eq(true, i, n, 2, true)));
        assertTrue(facts.contains(eq(true, n, i, -2, true)));
        assertTrue(facts.contains(eq(false, n, i, -2, false)));
    }

    public void testOtherArithmeticIgnored() {
        Instruction product = builder.binaryOp(bb, BinaryOpInstruction.Operator.MUL, n, builder.constant(bb, 2));
        Set<ComparisonFact> facts = propagation.getFacts(compare(CompareInstruction.Operator.LT, i, product));
        for (ComparisonFact f : facts) {
            assertNotSame(n, f.getLeft());
            assertNotSame(n, f.getRight());
        }
    }

    public void testLogicalNot() {
        Instruction test = compare(CompareInstruction.Operator.LT, i, n);
        LogicalNotInstruction not = builder.not(bb, test);
        Set<ComparisonFact> facts = propagation.getFacts(not);
        assertTrue(facts.contains(lt(false, i, n, 0, true)));
        assertTrue(facts.contains(lt(true, i, n, 0, false)));
        assertEquals(propagation.getFacts(test).size(), facts.size());
    }

    public void testDoubleNegation() {
        Instruction test = compare(CompareInstruction.Operator.LE, i, plus(n, 5));
        LogicalNotInstruction notNot = builder.not(bb, builder.not(bb, test));
        assertEquals(propagation.getFacts(test), propagation.getFacts(notNot));
    }

    public void testOverflowSkipsRule() {
        // i < n - MIN: n - MIN cannot be absorbed into k
        Instruction test = compare(CompareInstruction.Operator.LT, i, minus(n, Long.MIN_VALUE));
        for (ComparisonFact f : propagation.getFacts(test)) {
            assertFalse("Derived " + f, f.getLeft() == i && f.getRight() == n);
        }
    }

    public void testCheckedArithmetic() {
        assertEquals(Long.valueOf(5), ComparisonPropagation.add(2, 3));
        assertNull(ComparisonPropagation.add(Long.MAX_VALUE, 1));
        assertNull(ComparisonPropagation.add(Long.MIN_VALUE, -1));
        assertEquals(Long.valueOf(Long.MIN_VALUE), ComparisonPropagation.subtract(-1, Long.MAX_VALUE));
        assertNull(ComparisonPropagation.subtract(0, Long.MIN_VALUE));
        assertNull(ComparisonPropagation.subtract(1, Long.MIN_VALUE));
    }

    public void testNoContradictoryFacts() {
        Instruction[] tests = {
                compare(CompareInstruction.Operator.LT, i, n),
                compare(CompareInstruction.Operator.GE, plus(i, 1), minus(n, 4)),
                compare(CompareInstruction.Operator.EQ, minus(i, 7), plus(n, 7)),
                compare(CompareInstruction.Operator.NE, i, plus(i, 1)),
                builder.not(bb, compare(CompareInstruction.Operator.GT, plus(plus(i, 1), 2), n)) };
        for (Instruction test : tests) {
            Set<ComparisonFact> facts = propagation.getFacts(test);
            for (ComparisonFact f : facts) {
                ComparisonFact opposite = new ComparisonFact(f.getTestIsTrue(),
                                                             f.getLeft(),
                                                             f.getRight(),
                                                             f.getK(),
                                                             f.getRelation(),
                                                             !f.getValue());
                assertFalse(test + " derives both " + f + " and " + opposite, facts.contains(opposite));
            }
        }
    }

    /**
     * Every fact for the observed truth value of the test holds on concrete values
     */
    public void testFactsHoldOnConcreteValues() {
        Instruction[] tests = {
                compare(CompareInstruction.Operator.LT, i, plus(n, 3)),
                compare(CompareInstruction.Operator.LE, minus(i, 2), n),
                compare(CompareInstruction.Operator.GT, plus(i, 1), minus(n, 1)),
                compare(CompareInstruction.Operator.GE, i, builder.binaryOp(bb,
                                                                           BinaryOpInstruction.Operator.ADD,
                                                                           builder.constant(bb, -6),
                                                                           n)),
                compare(CompareInstruction.Operator.EQ, plus(i, 4), n),
                compare(CompareInstruction.Operator.NE, i, minus(n, 1)),
                builder.not(bb, compare(CompareInstruction.Operator.LT, n, plus(i, 2))) };
        Random rand = new Random(1234);
        for (int trial = 0; trial < 500; trial++) {
            Map<Instruction, Long> inputs = new HashMap<>();
            inputs.put(i, (long) rand.nextInt(21) - 10);
            inputs.put(n, (long) rand.nextInt(21) - 10);
            for (Instruction test : tests) {
                boolean testValue = evaluate(test, inputs) != 0;
                for (ComparisonFact f : propagation.getFacts(test)) {
                    if (f.getTestIsTrue() != testValue) {
                        continue;
                    }
                    long left = evaluate(f.getLeft(), inputs);
                    long right = evaluate(f.getRight(), inputs);
                    assertEquals(f + " with " + inputs,
                                 f.getValue(),
                                 f.getRelation().holds(left, right, f.getK()));
                }
            }
        }
    }

    /**
     * Compute the value of an instruction, booleans are 1 and 0
     */
    private static long evaluate(Instruction inst, Map<Instruction, Long> inputs) {
        if (inst instanceof ValueInstruction) {
            return inputs.get(inst);
        }
        if (inst instanceof ConstantInstruction) {
            return ((ConstantInstruction) inst).getValue();
        }
        if (inst instanceof BinaryOpInstruction) {
            BinaryOpInstruction b = (BinaryOpInstruction) inst;
            long l = evaluate(b.getLeft(), inputs);
            long r = evaluate(b.getRight(), inputs);
            switch (b.getOperator()) {
            case ADD:
                return l + r;
            case SUB:
                return l - r;
            case MUL:
                return l * r;
            default:
                throw new IllegalArgumentException("Not used in these tests: " + inst);
            }
        }
        if (inst instanceof CompareInstruction) {
            CompareInstruction c = (CompareInstruction) inst;
            return c.getOperator().evaluate(evaluate(c.getLeft(), inputs), evaluate(c.getRight(), inputs)) ? 1 : 0;
        }
        if (inst instanceof LogicalNotInstruction) {
            return evaluate(((LogicalNotInstruction) inst).getOperand(), inputs) == 0 ? 1 : 0;
        }
        throw new IllegalArgumentException("Cannot evaluate " + inst);
    }
}
