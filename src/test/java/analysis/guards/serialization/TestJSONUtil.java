package analysis.guards.serialization;

import java.util.Arrays;

import org.json.JSONArray;
import org.json.JSONObject;

import junit.framework.TestCase;
import analysis.guards.ComparisonFact;
import analysis.guards.Relation;
import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.ControlFlowGraphBuilder;
import analysis.guards.cfg.ValueInstruction;

public class TestJSONUtil extends TestCase {

    public void testFact() {
        ControlFlowGraphBuilder b = new ControlFlowGraphBuilder("json");
        BasicBlock bb = b.newBlock();
        ValueInstruction i = b.value(bb, "i");
        ValueInstruction n = b.value(bb, "n");
        JSONObject json = JSONUtil.toJSON(new ComparisonFact(false, i, n, -3, Relation.LT, true));
        assertFalse(json.getBoolean("testIsTrue"));
        assertEquals("i", json.getString("left"));
        assertEquals("n", json.getString("right"));
        assertEquals(-3L, json.getLong("k"));
        assertEquals("LT", json.getString("relation"));
        assertTrue(json.getBoolean("value"));
    }

    public void testBlockNumbers() {
        ControlFlowGraphBuilder b = new ControlFlowGraphBuilder("json");
        BasicBlock b0 = b.newBlock();
        BasicBlock b1 = b.newBlock();
        JSONArray array = JSONUtil.blockNumbers(Arrays.asList(b1, b0));
        assertEquals(2, array.length());
        assertEquals(1, array.getInt(0));
        assertEquals(0, array.getInt(1));
    }
}
