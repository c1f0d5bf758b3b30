import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.vcalc.latex.ConversionResult;
import com.vcalc.latex.RenderOptions;
import com.vcalc.latex.VCalcException;
import com.vcalc.latex.VCalcLatex;
import com.vcalc.latex.parser.Complex;
import com.vcalc.latex.parser.Value;
import com.vcalc.protocol.ConversionJson;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionJsonTest {

    @Test
    void resultCarriesLatexAndTypedVariables() throws Exception {
        ConversionResult r = new VCalcLatex().convert("x = 5\ny = x / 2\nz = 1 + 2j\nok = y > 2");
        JsonNode root = ConversionJson.mapper().readTree(ConversionJson.toJson(r));

        assertEquals(r.latex(), root.get("latex").asText());
        JsonNode vars = root.get("variables");
        assertEquals(Arrays.asList("x", "y", "z", "ok"), fieldNames(vars));

        assertEquals(5, vars.get("x").get("value").asInt());
        assertEquals("int", vars.get("x").get("type").asText());
        assertEquals(2.5, vars.get("y").get("value").asDouble());
        assertEquals("float", vars.get("y").get("type").asText());
        assertEquals("(1+2j)", vars.get("z").get("value").asText());
        assertEquals("complex", vars.get("z").get("type").asText());
        assertTrue(vars.get("ok").get("value").booleanValue());
    }

    @Test
    void prettyAndCompactEncodeTheSameDocument() throws Exception {
        ConversionResult r = new VCalcLatex().convert("a = 1");
        String pretty = ConversionJson.toPrettyJson(r);
        assertTrue(pretty.contains("\n"));
        assertEquals(ConversionJson.mapper().readTree(ConversionJson.toJson(r)), ConversionJson.mapper().readTree(pretty));
    }

    @Test
    void emptyConversion() throws Exception {
        JsonNode root = ConversionJson.mapper().readTree(ConversionJson.toJson(new VCalcLatex().convert("print(1)")));
        assertEquals("", root.get("latex").asText());
        assertEquals(0, root.get("variables").size());
    }

    @Test
    void valueEncoding() {
        assertEquals("\"inf\"", ConversionJson.toNode(Value.real(Double.POSITIVE_INFINITY)).toString());
        assertEquals("\"nan\"", ConversionJson.toNode(Value.real(Double.NaN)).toString());
        assertEquals("123456789012345678901234567890",
                ConversionJson.toNode(new VCalcLatex().convert("n = 123456789012345678901234567890").variables().get("n")).toString());
        assertEquals("[1,\"a\",null]", ConversionJson.toNode(Value.tuple(Arrays.asList(Value.integer(1), Value.string("a"), Value.none()))).toString());

        Map<Value, Value> dict = new LinkedHashMap<>();
        dict.put(Value.integer(1), Value.bool(true));
        dict.put(Value.string("k"), Value.real(0.5));
        assertEquals("{\"1\":true,\"k\":0.5}", ConversionJson.toNode(Value.dict(dict)).toString());
        assertEquals("\"sqrt\"", ConversionJson.toNode(Value.func("sqrt")).toString());
    }

    @Test
    void settingsDefaultsAndOverrides() {
        assertEquals(RenderOptions.defaults(), ConversionJson.readSettings("{}"));
        RenderOptions o = ConversionJson.readSettings("{\"showSubstitution\": false, \"theme\": \"dark\"}");
        assertTrue(o.includeSymbolic());
        assertFalse(o.includeSubstitution());
        assertTrue(o.includeResult());
        assertEquals(RenderOptions.defaults(), ConversionJson.readSettings("{\"showResult\": null}"));
    }

    @Test
    void badSettingsAreRejected() {
        assertThrows(VCalcException.class, () -> ConversionJson.readSettings("{\"showResult\": \"no\"}"));
        assertThrows(VCalcException.class, () -> ConversionJson.readSettings("[true]"));
        assertThrows(VCalcException.class, () -> ConversionJson.readSettings("{"));
        assertThrows(VCalcException.class, () -> ConversionJson.readSettings(""));
    }

    @Test
    void variablesFromPlainJson() {
        Map<String, Value> vars = ConversionJson.readVariables("{\"g\": 9.81, \"n\": 3, \"name\": \"beam\", \"xs\": [1, 2], \"on\": true, \"nil\": null}");
        assertEquals(Arrays.asList("g", "n", "name", "xs", "on", "nil"), Arrays.asList(vars.keySet().toArray()));
        assertEquals(Value.Type.REAL, vars.get("g").type);
        assertEquals(Value.Type.INT, vars.get("n").type);
        assertEquals(Value.string("beam"), vars.get("name"));
        assertEquals("[1, 2]", vars.get("xs").repr());
        assertEquals(Value.bool(true), vars.get("on"));
        assertEquals(Value.none(), vars.get("nil"));
        assertThrows(VCalcException.class, () -> ConversionJson.readVariables("[1]"));
    }

    @Test
    void typedDecodingRestoresPythonTypes() {
        Value z = ConversionJson.fromNode(TextNode.valueOf("(1.5-2j)"), "complex");
        assertEquals(new Complex(1.5, -2.0), z.asComplex());
        assertEquals(new Complex(0.0, 2.0), ConversionJson.fromNode(TextNode.valueOf("2j"), "complex").asComplex());
        assertEquals(new Complex(1e-07, -1.0), ConversionJson.fromNode(TextNode.valueOf("(1e-07-1j)"), "complex").asComplex());
        assertEquals(new Complex(0.0, 1.5e-07), ConversionJson.fromNode(TextNode.valueOf("1.5e-07j"), "complex").asComplex());

        assertEquals(Double.NEGATIVE_INFINITY, ConversionJson.fromNode(TextNode.valueOf("-inf"), "float").asReal());
        assertEquals(Value.Type.REAL, ConversionJson.fromNode(ConversionJson.toNode(Value.real(2.0)), "float").type);
        assertEquals(Value.Type.TUPLE, ConversionJson.fromNode(ConversionJson.toNode(Value.tuple(Arrays.asList(Value.integer(1)))), "tuple").type);
        assertEquals(Value.string("inf"), ConversionJson.fromNode(TextNode.valueOf("inf"), "str"));
        assertThrows(VCalcException.class, () -> ConversionJson.fromNode(TextNode.valueOf("abc"), "float"));
    }

    private static List<String> fieldNames(JsonNode n) {
        List<String> out = new ArrayList<>();
        n.fieldNames().forEachRemaining(out::add);
        return out;
    }
}
