package analysis.guards.serialization;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.BinaryOpInstruction;
import analysis.guards.cfg.CompareInstruction;
import analysis.guards.cfg.ConditionalBranchInstruction;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.cfg.ControlFlowGraphBuilder;
import analysis.guards.cfg.Instruction;
import analysis.guards.cfg.SourceCondition;

/**
 * Reads control flow graphs from their JSON description:
 *
 * <pre>
 * {"functions": [
 *   {"name": "f",
 *    "blocks": [
 *      {"id": 0, "instructions": [{"id": 1, "kind": "value", "name": "i"}, ...], "succs": [1]},
 *      ...],
 *    "conditions": [{"and": [{"instr": 3}, {"not": {"instr": 5}}]}]}]}
 * </pre>
 *
 * The first block listed is the entry. Instruction ids are local to a function, operands must refer to instructions
 * listed earlier. Instruction kinds and their fields:
 * <ul>
 * <li><code>value</code> - <code>name</code> (optional)</li>
 * <li><code>constant</code> - <code>value</code></li>
 * <li><code>binop</code> - <code>op</code>, <code>left</code>, <code>right</code></li>
 * <li><code>compare</code> - <code>op</code>, <code>left</code>, <code>right</code></li>
 * <li><code>not</code> - <code>operand</code></li>
 * <li><code>branch</code> - <code>condition</code> (optional), <code>true</code>, <code>false</code> (block ids);
 * must be the last instruction of its block</li>
 * </ul>
 * Operators are given either by name (<code>"LE"</code>) or by symbol (<code>"&lt;="</code>).
 */
public class CFGReader {

    /**
     * Level of output, higher means more is printed
     */
    private final int outputLevel;

    /**
     * Create a reader
     *
     * @param outputLevel
     *            level of output, higher means more is printed
     */
    public CFGReader(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    /**
     * Read all the functions in a file
     *
     * @param file
     *            JSON file
     * @return control flow graph for each function, in the order of the file
     * @throws IOException
     *             file could not be read
     */
    public List<ControlFlowGraph> read(Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        }
    }

    /**
     * Read all the functions from a reader
     *
     * @param r
     *            reader for the JSON text, will not be closed
     * @return control flow graph for each function, in the order they are listed
     */
    public List<ControlFlowGraph> read(Reader r) {
        JSONObject root;
        try {
            root = new JSONObject(new JSONTokener(r));
        } catch (JSONException e) {
            throw new CFGFormatException(null, "not a JSON object: " + e.getMessage(), e);
        }
        JSONArray functions = root.optJSONArray("functions");
        if (functions == null) {
            throw new CFGFormatException(null, "missing \"functions\" array");
        }
        List<ControlFlowGraph> cfgs = new ArrayList<>(functions.length());
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < functions.length(); i++) {
            JSONObject f = functions.optJSONObject(i);
            if (f == null) {
                throw new CFGFormatException(null, "function " + i + " is not an object");
            }
            ControlFlowGraph cfg = readFunction(f);
            if (!names.add(cfg.getName())) {
                throw new CFGFormatException(cfg.getName(), "duplicate function name");
            }
            cfgs.add(cfg);
        }
        if (outputLevel >= 1) {
            System.err.println("READ " + cfgs.size() + " functions");
        }
        return cfgs;
    }

    /**
     * Read the description of one function
     *
     * @param f
     *            JSON object for the function
     * @return control flow graph for the function
     */
    public ControlFlowGraph readFunction(JSONObject f) {
        String name = f.optString("name", null);
        if (name == null) {
            throw new CFGFormatException(null, "function without a name");
        }
        try {
            return new FunctionReader(name).read(f);
        } catch (JSONException e) {
            throw new CFGFormatException(name, e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // rejected by the builder
            throw new CFGFormatException(name, e.getMessage(), e);
        }
    }

    /**
     * State for reading a single function
     */
    private static class FunctionReader {

        private final String name;
        private final ControlFlowGraphBuilder builder;
        private final Map<Integer, BasicBlock> blocks = new HashMap<>();
        private final Map<Integer, Instruction> instructions = new HashMap<>();

        FunctionReader(String name) {
            this.name = name;
            this.builder = new ControlFlowGraphBuilder(name);
        }

        ControlFlowGraph read(JSONObject f) {
            JSONArray bbs = f.getJSONArray("blocks");
            if (bbs.length() == 0) {
                throw new CFGFormatException(name, "no basic blocks");
            }
            // Create all the blocks first so branches and edges can refer to later ones
            for (int i = 0; i < bbs.length(); i++) {
                int id = bbs.getJSONObject(i).getInt("id");
                if (blocks.put(id, builder.newBlock()) != null) {
                    throw new CFGFormatException(name, "duplicate block id " + id);
                }
            }
            for (int i = 0; i < bbs.length(); i++) {
                JSONObject bb = bbs.getJSONObject(i);
                BasicBlock block = blocks.get(bb.getInt("id"));
                JSONArray insts = bb.optJSONArray("instructions");
                if (insts != null) {
                    for (int j = 0; j < insts.length(); j++) {
                        readInstruction(block, insts.getJSONObject(j));
                    }
                }
            }
            // Unconditional edges, after all the branches are in place
            for (int i = 0; i < bbs.length(); i++) {
                JSONObject bb = bbs.getJSONObject(i);
                BasicBlock block = blocks.get(bb.getInt("id"));
                JSONArray succs = bb.optJSONArray("succs");
                if (succs == null) {
                    continue;
                }
                Instruction last = block.getLastInstruction();
                for (int j = 0; j < succs.length(); j++) {
                    BasicBlock succ = getBlock(succs.getInt(j));
                    if (last instanceof ConditionalBranchInstruction) {
                        ConditionalBranchInstruction br = (ConditionalBranchInstruction) last;
                        if (succ != br.getTrueTarget() && succ != br.getFalseTarget()) {
                            throw new CFGFormatException(name, "successor " + succs.getInt(j) + " of block "
                                    + bb.getInt("id") + " is not a target of its branch");
                        }
                        continue;
                    }
                    builder.addEdge(block, succ);
                }
            }
            JSONArray conditions = f.optJSONArray("conditions");
            if (conditions != null) {
                for (int i = 0; i < conditions.length(); i++) {
                    builder.addSourceCondition(readCondition(conditions.getJSONObject(i)));
                }
            }
            return builder.build();
        }

        private void readInstruction(BasicBlock bb, JSONObject json) {
            int id = json.getInt("id");
            if (instructions.containsKey(id)) {
                throw new CFGFormatException(name, "duplicate instruction id " + id);
            }
            String kind = json.getString("kind");
            Instruction i;
            switch (kind) {
            case "value":
                i = builder.value(bb, json.optString("name", null));
                break;
            case "constant":
                i = builder.constant(bb, json.getLong("value"));
                break;
            case "binop":
                i = builder.binaryOp(bb,
                                     binaryOperator(json.getString("op")),
                                     getInstruction(json, "left"),
                                     getInstruction(json, "right"));
                break;
            case "compare":
                i = builder.compare(bb,
                                    compareOperator(json.getString("op")),
                                    getInstruction(json, "left"),
                                    getInstruction(json, "right"));
                break;
            case "not":
                i = builder.not(bb, getInstruction(json, "operand"));
                break;
            case "branch":
                Instruction condition = json.has("condition") ? getInstruction(json, "condition") : null;
                i = builder.branch(bb, condition, getBlock(json.getInt("true")), getBlock(json.getInt("false")));
                break;
            default:
                throw new CFGFormatException(name, "unknown kind \"" + kind + "\" for instruction " + id);
            }
            instructions.put(id, i);
        }

        private SourceCondition readCondition(JSONObject json) {
            if (json.has("instr")) {
                return SourceCondition.of(getInstruction(json, "instr"));
            }
            if (json.has("not")) {
                return SourceCondition.not(readCondition(json.getJSONObject("not")));
            }
            if (json.has("and")) {
                JSONArray ops = operands(json.getJSONArray("and"));
                return SourceCondition.and(readCondition(ops.getJSONObject(0)), readCondition(ops.getJSONObject(1)));
            }
            if (json.has("or")) {
                JSONArray ops = operands(json.getJSONArray("or"));
                return SourceCondition.or(readCondition(ops.getJSONObject(0)), readCondition(ops.getJSONObject(1)));
            }
            throw new CFGFormatException(name, "unknown source condition " + json);
        }

        private JSONArray operands(JSONArray ops) {
            if (ops.length() != 2) {
                throw new CFGFormatException(name, "logical operator needs two operands, found " + ops.length());
            }
            return ops;
        }

        private Instruction getInstruction(JSONObject json, String key) {
            int id = json.getInt(key);
            Instruction i = instructions.get(id);
            if (i == null) {
                throw new CFGFormatException(name, "instruction " + id + " used before it is defined");
            }
            return i;
        }

        private BasicBlock getBlock(int id) {
            BasicBlock bb = blocks.get(id);
            if (bb == null) {
                throw new CFGFormatException(name, "no block with id " + id);
            }
            return bb;
        }

        private BinaryOpInstruction.Operator binaryOperator(String op) {
            for (BinaryOpInstruction.Operator o : BinaryOpInstruction.Operator.values()) {
                if (o.name().equals(op) || o.getSymbol().equals(op)) {
                    return o;
                }
            }
            throw new CFGFormatException(name, "unknown arithmetic operator " + op);
        }

        private CompareInstruction.Operator compareOperator(String op) {
            for (CompareInstruction.Operator o : CompareInstruction.Operator.values()) {
                if (o.name().equals(op) || o.getSymbol().equals(op)) {
                    return o;
                }
            }
            throw new CFGFormatException(name, "unknown comparison operator " + op);
        }
    }
}
