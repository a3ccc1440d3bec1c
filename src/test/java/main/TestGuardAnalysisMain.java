package main;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

import junit.framework.TestCase;
import analysis.guards.GuardResults;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.serialization.CFGReader;

public class TestGuardAnalysisMain extends TestCase {

    private static List<ControlFlowGraph> readFixture() throws IOException {
        try (Reader r = new InputStreamReader(TestGuardAnalysisMain.class.getResourceAsStream("/cfg/guards.json"),
                                              StandardCharsets.UTF_8)) {
            return new CFGReader(0).read(r);
        }
    }

    public void testAnalyzeKeepsOrder() throws IOException {
        List<ControlFlowGraph> cfgs = readFixture();
        List<GuardResults> results = GuardAnalysisMain.analyze(cfgs, 2, 0);
        assertEquals(cfgs.size(), results.size());
        for (int j = 0; j < cfgs.size(); j++) {
            assertSame(cfgs.get(j), results.get(j).getControlFlowGraph());
        }
    }

    public void testSingleThreadMatchesParallel() throws IOException {
        List<ControlFlowGraph> cfgs = readFixture();
        JSONObject one = GuardAnalysisMain.toJSON(GuardAnalysisMain.analyze(cfgs, 1, 0));
        JSONObject many = GuardAnalysisMain.toJSON(GuardAnalysisMain.analyze(cfgs, 4, 0));
        assertTrue(one.similar(many));
    }

    public void testConjunctionResults() throws IOException {
        JSONObject json = GuardAnalysisMain.toJSON(GuardAnalysisMain.analyze(readFixture(), 2, 0));
        JSONArray functions = json.getJSONArray("functions");
        assertEquals(2, functions.length());
        JSONObject conjunction = functions.getJSONObject(1);
        assertEquals("conjunction", conjunction.getString("function"));
        boolean foundAnd = false;
        for (int j = 0; j < conjunction.getJSONArray("guards").length(); j++) {
            JSONObject guard = conjunction.getJSONArray("guards").getJSONObject(j);
            if (guard.getString("kind").equals("LOGICAL_COMBINATOR")) {
                foundAnd = true;
                JSONArray controlled = guard.getJSONObject("controls").getJSONArray("true");
                assertEquals(1, controlled.length());
                assertEquals(2, controlled.getInt(0));
                // i < n and i != 0 hold in B2
                assertEquals(4, guard.getJSONObject("ensures").getJSONArray("2").length());
            }
        }
        assertTrue(foundAnd);
    }

    public void testMainWritesFiles() throws Exception {
        Path out = Files.createTempDirectory("guards");
        String in = Paths.get(TestGuardAnalysisMain.class.getResource("/cfg/guards.json").toURI()).toString();
        GuardAnalysisMain.main(new String[] { "-in", in, "-out", out.toString(), "-fileLevel", "1", "-t", "2" });
        File results = out.resolve(GuardAnalysisMain.RESULTS_FILE).toFile();
        assertTrue(results.exists());
        JSONObject json = new JSONObject(new String(Files.readAllBytes(results.toPath()), StandardCharsets.UTF_8));
        assertEquals(2, json.getJSONArray("functions").length());
        assertTrue(out.resolve("cfg_bounds.dot").toFile().exists());
        assertTrue(out.resolve("cfg_conjunction.dot").toFile().exists());
    }
}
