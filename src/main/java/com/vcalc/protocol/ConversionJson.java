package com.vcalc.protocol;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcalc.latex.ConversionResult;
import com.vcalc.latex.RenderOptions;
import com.vcalc.latex.VCalcException;
import com.vcalc.latex.parser.Complex;
import com.vcalc.latex.parser.Value;

/**
 * JSON surface of the converter.
 *
 * Result shape:
 *   {"latex": "...", "variables": {"x": {"value": 5, "type": "int"}}}
 *
 * Value encoding:
 *  - int, float -> number (non-finite floats as "inf", "-inf", "nan")
 *  - complex    -> Python repr string, e.g. "(1+2j)"
 *  - bool, str  -> boolean, string
 *  - list/tuple -> array; dict -> object with str() keys; None -> null
 *  - functions  -> their name
 */
public final class ConversionJson {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private ConversionJson() {}

    public static ObjectMapper mapper() {
        return om;
    }

    // ===================== ENCODING =====================

    public static ObjectNode toNode(ConversionResult result) {
        ObjectNode root = nodes.objectNode();
        root.put("latex", result.latex());
        ObjectNode vars = root.putObject("variables");
        for (Map.Entry<String, Value> e : result.variables().entrySet()) {
            ObjectNode info = vars.putObject(e.getKey());
            info.set("value", toNode(e.getValue()));
            info.put("type", e.getValue().pyTypeName());
        }
        return root;
    }

    public static String toJson(ConversionResult result) {
        return write(toNode(result), false);
    }

    public static String toPrettyJson(ConversionResult result) {
        return write(toNode(result), true);
    }

    public static JsonNode toNode(Value v) {
        switch (v.type) {
            case INT:
                return nodes.numberNode(v.asInt());
            case REAL: {
                double d = v.asReal();
                if (Double.isNaN(d) || Double.isInfinite(d)) return nodes.textNode(v.repr());
                return nodes.numberNode(d);
            }
            case COMPLEX:
                return nodes.textNode(v.repr());
            case BOOL:
                return nodes.booleanNode(v.asBool());
            case STRING:
                return nodes.textNode(v.asString());
            case LIST:
            case TUPLE: {
                ArrayNode arr = nodes.arrayNode();
                for (Value item : v.asList()) arr.add(toNode(item));
                return arr;
            }
            case DICT: {
                ObjectNode obj = nodes.objectNode();
                for (Map.Entry<Value, Value> e : v.asDict().entrySet()) {
                    obj.set(e.getKey().toString(), toNode(e.getValue()));
                }
                return obj;
            }
            case FUNC:
                return nodes.textNode(v.asFunc());
            default:
                return nodes.nullNode();
        }
    }

    static String write(JsonNode node, boolean pretty) {
        try {
            return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(node) : om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new VCalcException("failed to encode JSON", e);
        }
    }

    // ===================== DECODING =====================

    /**
     * Settings document with the boolean fields {@code showSymbolic},
     * {@code showSubstitution} and {@code showResult}. Missing fields keep
     * their defaults, unknown fields are ignored.
     */
    public static RenderOptions readSettings(String json) {
        JsonNode root = read(json, "settings");
        if (!root.isObject()) throw new VCalcException("settings must be a JSON object");
        RenderOptions defaults = RenderOptions.defaults();
        return RenderOptions.builder()
                .symbolic(flag(root, "showSymbolic", defaults.includeSymbolic()))
                .substitution(flag(root, "showSubstitution", defaults.includeSubstitution()))
                .result(flag(root, "showResult", defaults.includeResult()))
                .build();
    }

    /** A JSON object of name -> plain JSON value, for variable injection. */
    public static Map<String, Value> readVariables(String json) {
        JsonNode root = read(json, "variables");
        if (!root.isObject()) throw new VCalcException("variables must be a JSON object");
        Map<String, Value> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), fromNode(e.getValue()));
        }
        return out;
    }

    /** Plain JSON to a value: integral numbers become ints, other numbers floats. */
    public static Value fromNode(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return Value.none();
        if (n.isBoolean()) return Value.bool(n.booleanValue());
        if (n.isIntegralNumber()) return Value.integer(n.bigIntegerValue());
        if (n.isNumber()) return Value.real(n.doubleValue());
        if (n.isTextual()) return Value.string(n.textValue());
        if (n.isArray()) {
            List<Value> items = new ArrayList<>();
            for (JsonNode item : n) items.add(fromNode(item));
            return Value.list(items);
        }
        Map<Value, Value> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = n.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            entries.put(Value.string(e.getKey()), fromNode(e.getValue()));
        }
        return Value.dict(entries);
    }

    /**
     * Inverse of {@link #toNode(Value)} guided by the Python type name stored
     * next to the value, so complex numbers, tuples and non-finite floats
     * come back with their original type.
     */
    public static Value fromNode(JsonNode n, String pyType) {
        if (pyType == null || n == null) return fromNode(n);
        switch (pyType) {
            case "float":
                if (n.isTextual()) return Value.real(parseReal(n.textValue()));
                if (n.isNumber()) return Value.real(n.doubleValue());
                break;
            case "complex":
                if (n.isTextual()) return Value.complex(parseComplex(n.textValue()));
                if (n.isNumber()) return Value.complex(n.doubleValue(), 0.0);
                break;
            case "tuple":
                if (n.isArray()) return Value.tuple(fromNode(n).asList());
                break;
            default:
                break;
        }
        return fromNode(n);
    }

    static double parseReal(String text) {
        String s = text.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "inf":
            case "+inf": return Double.POSITIVE_INFINITY;
            case "-inf": return Double.NEGATIVE_INFINITY;
            case "nan":
            case "+nan":
            case "-nan": return Double.NaN;
            default:
                try {
                    return Double.parseDouble(s);
                } catch (NumberFormatException e) {
                    throw new VCalcException("not a float: '" + text + "'", e);
                }
        }
    }

    /** Parses Python complex repr text: {@code 2j}, {@code (1+2j)}, {@code (-0-1.5e-07j)}, {@code (nan+infj)}. */
    static Complex parseComplex(String text) {
        String s = text.trim();
        if (s.startsWith("(") && s.endsWith(")")) s = s.substring(1, s.length() - 1).trim();
        if (!s.endsWith("j") && !s.endsWith("J")) {
            return new Complex(parseReal(s), 0.0);
        }
        s = s.substring(0, s.length() - 1);
        int split = -1;
        for (int i = s.length() - 1; i > 0; i--) {
            char c = s.charAt(i);
            char prev = Character.toLowerCase(s.charAt(i - 1));
            if ((c == '+' || c == '-') && prev != 'e') {
                split = i;
                break;
            }
        }
        if (split < 0) return new Complex(0.0, imag(s));
        return new Complex(parseReal(s.substring(0, split)), imag(s.substring(split)));
    }

    private static double imag(String s) {
        if (s.isEmpty() || s.equals("+")) return 1.0;
        if (s.equals("-")) return -1.0;
        return parseReal(s);
    }

    private static boolean flag(JsonNode root, String field, boolean fallback) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) return fallback;
        if (!n.isBoolean()) throw new VCalcException("setting '" + field + "' must be true or false");
        return n.booleanValue();
    }

    static JsonNode read(String json, String what) {
        try {
            JsonNode root = om.readTree(json);
            if (root == null || root.isMissingNode()) throw new VCalcException("empty " + what + " document");
            return root;
        } catch (JsonProcessingException e) {
            throw new VCalcException("invalid " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }
}
