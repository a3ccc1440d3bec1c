package analysis.guards.serialization;

import java.util.Collection;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.guards.ComparisonFact;
import analysis.guards.cfg.BasicBlock;

/**
 * Helpers for writing analysis results as JSON
 */
public class JSONUtil {

    /**
     * Serialize the given {@link ComparisonFact}
     *
     * @param f
     *            fact to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(ComparisonFact f) {
        JSONObject json = new JSONObject();
        addJSON(json, "testIsTrue", f.getTestIsTrue());
        addJSON(json, "left", f.getLeft().valueString());
        addJSON(json, "right", f.getRight().valueString());
        try {
            json.put("k", f.getK());
        } catch (JSONException e) {
            System.err.println("Serialization error in " + f + ", message: " + e.getMessage());
        }
        addJSON(json, "relation", f.getRelation().toString());
        addJSON(json, "value", f.getValue());
        return json;
    }

    /**
     * Serialize a collection of facts
     *
     * @param facts
     *            facts to serialize
     * @return array with one object per fact
     */
    public static JSONArray toJSON(Collection<ComparisonFact> facts) {
        JSONArray array = new JSONArray();
        for (ComparisonFact f : facts) {
            array.put(toJSON(f));
        }
        return array;
    }

    /**
     * Serialize basic blocks as their numbers
     *
     * @param blocks
     *            blocks to serialize
     * @return array of block numbers
     */
    public static JSONArray blockNumbers(Collection<BasicBlock> blocks) {
        JSONArray array = new JSONArray();
        for (BasicBlock bb : blocks) {
            array.put(bb.getNumber());
        }
        return array;
    }

    /**
     * Add the (key,value) pair to the given JSONObject. The existing {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param value
     *            string value to add to the JSON object
     */
    public static void addJSON(JSONObject json, String key, String value) {
        try {
            json.put(key, value);
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + value + "), message: " + e.getMessage());
        }
    }

    /**
     * Add the (key,value) pair to the given JSONObject. The existing {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param value
     *            boolean value to add to the JSON object
     */
    public static void addJSON(JSONObject json, String key, boolean value) {
        try {
            json.put(key, value);
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + value + "), message: " + e.getMessage());
        }
    }
}
