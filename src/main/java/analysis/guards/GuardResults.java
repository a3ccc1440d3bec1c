package analysis.guards;

import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.serialization.JSONSerializable;
import analysis.guards.serialization.JSONUtil;

/**
 * Everything the guard analysis found for one control flow graph: for each guard condition the blocks it controls for
 * each truth value, the comparison facts it implies and the facts it ensures in each block.
 */
public class GuardResults implements JSONSerializable {

    private final ControlFlowGraph cfg;
    private final List<GuardResult> results;

    /**
     * Compute all the results of a session
     *
     * @param session
     *            analysis session for one control flow graph
     */
    public GuardResults(GuardAnalysisSession session) {
        this.cfg = session.getControlFlowGraph();
        List<GuardResult> rs = new ArrayList<>();
        for (GuardCondition cond : session.getGuardConditions()) {
            rs.add(new GuardResult(session, cond));
        }
        this.results = Collections.unmodifiableList(rs);
    }

    public ControlFlowGraph getControlFlowGraph() {
        return cfg;
    }

    /**
     * Results for each guard condition
     *
     * @return unmodifiable list of results
     */
    public List<GuardResult> getResults() {
        return results;
    }

    /**
     * Number of facts ensured in any block, summed over all guard conditions
     *
     * @return total number of ensured facts
     */
    public int getNumberOfEnsuredFacts() {
        int count = 0;
        for (GuardResult r : results) {
            for (Set<ComparisonFact> facts : r.getEnsured().values()) {
                count += facts.size();
            }
        }
        return count;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "function", cfg.getName());
        JSONArray guards = new JSONArray();
        for (GuardResult r : results) {
            guards.put(r.toJSON());
        }
        json.put("guards", guards);
        return json;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out, 2, 0);
    }

    @Override
    public String toString() {
        return "Guard results for " + cfg.getName() + ": " + results.size() + " conditions, "
                + getNumberOfEnsuredFacts() + " ensured facts";
    }

    /**
     * Results for a single guard condition
     */
    public static final class GuardResult {

        private final GuardCondition condition;
        private final Set<BasicBlock> controlledIfTrue;
        private final Set<BasicBlock> controlledIfFalse;
        private final Set<ComparisonFact> comparisons;
        /**
         * Facts ensured in each block, blocks without any are left out
         */
        private final Map<BasicBlock, Set<ComparisonFact>> ensured;

        GuardResult(GuardAnalysisSession session, GuardCondition condition) {
            this.condition = condition;
            this.controlledIfTrue = session.getControlledBlocks(condition, true);
            this.controlledIfFalse = session.getControlledBlocks(condition, false);
            this.comparisons = session.getComparisons(condition);
            Map<BasicBlock, Set<ComparisonFact>> m = new LinkedHashMap<>();
            for (BasicBlock bb : session.getControlFlowGraph()) {
                Set<ComparisonFact> facts = session.getEnsuredFacts(condition, bb);
                if (!facts.isEmpty()) {
                    m.put(bb, Collections.unmodifiableSet(facts));
                }
            }
            this.ensured = Collections.unmodifiableMap(m);
        }

        public GuardCondition getCondition() {
            return condition;
        }

        /**
         * Blocks controlled by the condition
         *
         * @param testIsTrue
         *            truth value of the condition
         * @return blocks only reached when the condition evaluates to <code>testIsTrue</code>
         */
        public Set<BasicBlock> getControlledBlocks(boolean testIsTrue) {
            return testIsTrue ? controlledIfTrue : controlledIfFalse;
        }

        public Set<ComparisonFact> getComparisons() {
            return comparisons;
        }

        public Map<BasicBlock, Set<ComparisonFact>> getEnsured() {
            return ensured;
        }

        JSONObject toJSON() {
            JSONObject json = new JSONObject();
            JSONUtil.addJSON(json, "condition", condition.toString());
            JSONUtil.addJSON(json, "kind", condition.getKind().toString());
            JSONObject controls = new JSONObject();
            controls.put("true", JSONUtil.blockNumbers(controlledIfTrue));
            controls.put("false", JSONUtil.blockNumbers(controlledIfFalse));
            json.put("controls", controls);
            json.put("compares", JSONUtil.toJSON(comparisons));
            JSONObject ens = new JSONObject();
            for (Map.Entry<BasicBlock, Set<ComparisonFact>> e : ensured.entrySet()) {
                ens.put(Integer.toString(e.getKey().getNumber()), JSONUtil.toJSON(e.getValue()));
            }
            json.put("ensures", ens);
            return json;
        }
    }
}
