package com.vcalc.latex.store;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcalc.latex.VCalcException;
import com.vcalc.latex.parser.Value;
import com.vcalc.protocol.ConversionJson;

/**
 * VariableStore
 *
 * Variables shared between calculation blocks, keyed by
 * note path -> variable set (vset) -> variable name.
 *
 * Blocks in the same vset of a note see each other's variables. Every
 * variable remembers the block that defined it last, so re-running a block
 * can first drop what it defined before ({@link #removeBlockVariables}):
 *
 *   store.removeBlockVariables("physics.md", "main", "abc12345");
 *   store.updateVariable("physics.md", "main", "g", Value.real(9.81), "Constants", "abc12345");
 *   Map<String, Value> inject = store.values("physics.md", "main");
 *
 * JSON form (Jackson):
 * {
 *   "physics.md": {
 *     "main": {
 *       "g": {"value": 9.81, "type": "float", "blockTitle": "Constants",
 *             "sourceBlockId": "abc12345", "timestamp": 1700000000000}
 *     }
 *   }
 * }
 *
 * Not thread-safe.
 */
public final class VariableStore {

    private final LinkedHashMap<String, LinkedHashMap<String, LinkedHashMap<String, VariableInfo>>> notes = new LinkedHashMap<>();
    private final LongSupplier clock;

    public VariableStore() {
        this(System::currentTimeMillis);
    }

    public VariableStore(LongSupplier clock) {
        if (clock == null) throw new IllegalArgumentException("clock must not be null");
        this.clock = clock;
    }

    /** The vset's variables in definition order; empty when the note or vset is unknown. */
    public Map<String, VariableInfo> getVariables(String notePath, String vset) {
        Map<String, LinkedHashMap<String, VariableInfo>> sets = notes.get(notePath);
        if (sets == null) return Collections.emptyMap();
        Map<String, VariableInfo> vars = sets.get(vset);
        return (vars == null) ? Collections.emptyMap() : Collections.unmodifiableMap(vars);
    }

    /** Replaces the whole vset. */
    public void setVariables(String notePath, String vset, Map<String, VariableInfo> variables) {
        LinkedHashMap<String, VariableInfo> copy = new LinkedHashMap<>();
        if (variables != null) copy.putAll(variables);
        notes.computeIfAbsent(notePath, k -> new LinkedHashMap<>()).put(vset, copy);
    }

    public void updateVariable(String notePath, String vset, String name, Value value, String blockTitle, String blockId) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("variable name must not be empty");
        VariableInfo info = new VariableInfo(value, value.pyTypeName(), blockTitle, blockId, clock.getAsLong());
        notes.computeIfAbsent(notePath, k -> new LinkedHashMap<>())
                .computeIfAbsent(vset, k -> new LinkedHashMap<>())
                .put(name, info);
    }

    /**
     * Drops the variables whose last definer is {@code blockId}. Variables
     * another block has since redefined, and unowned ones, stay.
     */
    public void removeBlockVariables(String notePath, String vset, String blockId) {
        Map<String, LinkedHashMap<String, VariableInfo>> sets = notes.get(notePath);
        if (sets == null || blockId == null) return;
        Map<String, VariableInfo> vars = sets.get(vset);
        if (vars == null) return;
        vars.values().removeIf(info -> blockId.equals(info.sourceBlockId()));
    }

    public void clearNoteVariables(String notePath) {
        notes.remove(notePath);
    }

    /** Name -> value view of a vset, ready to inject into a conversion. */
    public Map<String, Value> values(String notePath, String vset) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, VariableInfo> e : getVariables(notePath, vset).entrySet()) {
            out.put(e.getKey(), e.getValue().value());
        }
        return out;
    }

    public boolean isEmpty() {
        return notes.isEmpty();
    }

    // ===================== JSON =====================

    public String toJson() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode root = nodes.objectNode();
        for (Map.Entry<String, LinkedHashMap<String, LinkedHashMap<String, VariableInfo>>> note : notes.entrySet()) {
            ObjectNode noteNode = root.putObject(note.getKey());
            for (Map.Entry<String, LinkedHashMap<String, VariableInfo>> set : note.getValue().entrySet()) {
                ObjectNode setNode = noteNode.putObject(set.getKey());
                for (Map.Entry<String, VariableInfo> var : set.getValue().entrySet()) {
                    VariableInfo info = var.getValue();
                    ObjectNode n = setNode.putObject(var.getKey());
                    n.set("value", ConversionJson.toNode(info.value()));
                    n.put("type", info.type());
                    n.put("blockTitle", info.blockTitle());
                    n.put("sourceBlockId", info.sourceBlockId());
                    n.put("timestamp", info.timestamp());
                }
            }
        }
        try {
            return ConversionJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (Exception e) {
            throw new VCalcException("failed to encode variable store", e);
        }
    }

    public static VariableStore fromJson(String json) {
        return fromJson(json, System::currentTimeMillis);
    }

    public static VariableStore fromJson(String json, LongSupplier clock) {
        VariableStore store = new VariableStore(clock);
        if (json == null || json.trim().isEmpty()) return store;

        JsonNode root;
        try {
            root = ConversionJson.mapper().readTree(json);
        } catch (Exception e) {
            throw new VCalcException("invalid variable store JSON", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) return store;
        if (!root.isObject()) throw new VCalcException("variable store must be a JSON object");

        for (Iterator<Map.Entry<String, JsonNode>> notesIt = root.fields(); notesIt.hasNext(); ) {
            Map.Entry<String, JsonNode> note = notesIt.next();
            for (Iterator<Map.Entry<String, JsonNode>> setsIt = note.getValue().fields(); setsIt.hasNext(); ) {
                Map.Entry<String, JsonNode> set = setsIt.next();
                LinkedHashMap<String, VariableInfo> vars = new LinkedHashMap<>();
                for (Iterator<Map.Entry<String, JsonNode>> varsIt = set.getValue().fields(); varsIt.hasNext(); ) {
                    Map.Entry<String, JsonNode> var = varsIt.next();
                    vars.put(var.getKey(), readInfo(var.getKey(), var.getValue()));
                }
                store.setVariables(note.getKey(), set.getKey(), vars);
            }
        }
        return store;
    }

    private static VariableInfo readInfo(String name, JsonNode n) {
        if (!n.isObject()) throw new VCalcException("variable '" + name + "' must be a JSON object");
        String type = text(n, "type");
        Value value = ConversionJson.fromNode(n.get("value"), type);
        return new VariableInfo(value, type, text(n, "blockTitle"), text(n, "sourceBlockId"), n.path("timestamp").asLong(0L));
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }
}
