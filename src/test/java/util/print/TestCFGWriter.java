package util.print;

import java.io.IOException;
import java.io.StringWriter;

import junit.framework.TestCase;
import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.CompareInstruction;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.cfg.ControlFlowGraphBuilder;
import analysis.guards.cfg.Instruction;
import analysis.guards.cfg.ValueInstruction;

public class TestCFGWriter extends TestCase {

    private ControlFlowGraph cfg;

    @Override
    protected void setUp() {
        ControlFlowGraphBuilder b = new ControlFlowGraphBuilder("f(int, int)");
        BasicBlock b0 = b.newBlock();
        BasicBlock b1 = b.newBlock();
        BasicBlock b2 = b.newBlock();
        BasicBlock dead = b.newBlock();
        ValueInstruction i = b.value(b0, "i");
        ValueInstruction n = b.value(b0, "n");
        Instruction c = b.compare(b0, CompareInstruction.Operator.LT, i, n);
        b.branch(b0, c, b1, b2);
        b.addEdge(b1, b2);
        b.addEdge(dead, b2);
        cfg = b.build();
    }

    public void testEdgeLabels() throws IOException {
        StringWriter sw = new StringWriter();
        new CFGWriter(cfg).write(sw, "", "\\l");
        String dot = sw.toString();
        assertTrue(dot, dot.startsWith("digraph G {"));
        assertTrue(dot, dot.contains("\"BB0\\lENTRY\\l\" -> \"BB1\\l\" [label=\"TRUE\"]"));
        assertTrue(dot, dot.contains("\"BB0\\lENTRY\\l\" -> \"BB2\\l\" [label=\"FALSE\"]"));
        assertTrue(dot, dot.contains("\"BB1\\l\" -> \"BB2\\l\" [label=\"NORMAL\"]"));
        assertTrue(dot, dot.contains("[label=\"UNREACHABLE NORMAL\"]"));
    }

    public void testVerbose() throws IOException {
        StringWriter sw = new StringWriter();
        new CFGWriter(cfg).writeVerbose(sw, "", "\\l");
        String dot = sw.toString();
        assertTrue(dot, dot.contains("i < n"));
        assertTrue(dot, dot.contains("goto BB1"));
    }

    public void testPrettyPrinter() {
        String s = PrettyPrinter.cfgString(cfg, "\t", "\n");
        assertTrue(s, s.startsWith("f(int, int)\n"));
        assertTrue(s, s.contains("BB0 (entry)"));
        assertTrue(s, s.contains("\tv3 = i < n\n"));
        assertEquals("f_int__int_", PrettyPrinter.fileNameString(cfg.getName()));
    }
}
