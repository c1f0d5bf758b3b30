import org.junit.jupiter.api.Test;

import com.vcalc.latex.CalcParseException;
import com.vcalc.latex.ConversionResult;
import com.vcalc.latex.ExpressionDepthException;
import com.vcalc.latex.RenderOptions;
import com.vcalc.latex.VCalcLatex;
import com.vcalc.latex.parser.Environment;
import com.vcalc.latex.parser.Value;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class VCalcLatexTest {

    private static String block(String... rows) {
        return "\\begin{aligned}\n" + String.join("\n", rows) + "\n\\end{aligned}";
    }

    @Test
    void givenValuesThenDerivation() {
        ConversionResult r = new VCalcLatex().convert("x = 5\ny = 10\nz = x + y");
        assertEquals(block("x &= 5", "\\\\", "y &= 10", "\\\\[10pt]", "z &= x + y = 5 + 10 = 15"), r.latex());
        assertEquals(3, r.records().size());
    }

    @Test
    void importsAndPrintsAreIgnored() {
        String src = "import math\n"
                + "a = 2\n"
                + "print(a)\n"
                + "b = a**2\n";
        assertEquals(block("a &= 2", "\\\\[10pt]", "b &= a^{2} = 2^{2} = 4"), new VCalcLatex().convert(src).latex());
    }

    @Test
    void failingStatementIsDroppedAndLaterOnesRun() {
        ConversionResult r = new VCalcLatex().convert("a = 1\nb = undefined_name + 1\nc = a + 1");
        assertEquals(block("a &= 1", "\\\\[10pt]", "c &= a + 1 = 1 + 1 = 2"), r.latex());
        assertFalse(r.variables().containsKey("b"));
        assertFalse(r.environment().containsKey("b"));
    }

    @Test
    void runtimeErrorsAreDroppedToo() {
        ConversionResult r = new VCalcLatex().convert("x = 1 / 0\ny = sqrt(-1)\nz = [1, 2][5]\nw = 2");
        assertEquals(block("w &= 2"), r.latex());
    }

    @Test
    void hostFunctionFailureDropsOnlyItsStatement() {
        VCalcLatex engine = new VCalcLatex();
        engine.registerFunction("boom", args -> {
            throw new IllegalStateException("host failure");
        });
        ConversionResult r = engine.convert("a = 1\nb = boom(a)\nc = a + 1");
        assertEquals(block("a &= 1", "\\\\[10pt]", "c &= a + 1 = 1 + 1 = 2"), r.latex());
        assertFalse(r.environment().containsKey("b"));
    }

    @Test
    void failedStatementLeavesEarlierBindingIntact() {
        ConversionResult r = new VCalcLatex().convert("x = 3\nx = x / 0\ny = x + 1");
        assertEquals(Value.integer(3), r.environment().get("x"));
        assertEquals(Value.integer(4), r.environment().get("y"));
    }

    @Test
    void nothingToRenderGivesEmptyString() {
        ConversionResult r = new VCalcLatex().convert("import math\nprint('hi')\n# just a comment\n");
        assertEquals("", r.latex());
        assertTrue(r.isEmpty());
        assertEquals("", new VCalcLatex().convert("").latex());
    }

    @Test
    void nonNameTargetsAndControlFlowAreSkipped() {
        String src = "a, b = 1, 2\n"
                + "p = q = 3\n"
                + "xs = [1, 2]\n"
                + "xs[0] = 5\n"
                + "if True:\n"
                + "    hidden = 1\n"
                + "def f(x):\n"
                + "    return x * 2\n"
                + "for i in range(3):\n"
                + "    pass\n"
                + "w = 2\n";
        ConversionResult r = new VCalcLatex().convert(src);
        assertEquals(Arrays.asList("xs", "w"), new java.util.ArrayList<>(r.variables().keySet()));
        assertEquals(block("xs &= \\left[1, 2\\right] = [1, 2]", "\\\\", "w &= 2"), r.latex());
    }

    @Test
    void realsSnapAndRound() {
        ConversionResult r = new VCalcLatex().convert("r = 0.1 + 0.2\ns = r * 10");
        assertEquals(block("r &= 0.1 + 0.2 = 0.3", "\\\\", "s &= r \\cdot 10 = 0.3 \\cdot 10 = 3"), r.latex());
    }

    @Test
    void greekNamesAndSubscripts() {
        ConversionResult r = new VCalcLatex().convert("Gamma_L = 0.5\nV_in = 2\nP = V_in**2 * Gamma_L");
        assertEquals(block("\\Gamma_{L} &= 0.5", "\\\\", "V_{in} &= 2", "\\\\[10pt]",
                "P &= V_{in}^{2} \\cdot \\Gamma_{L} = 2^{2} \\cdot 0.5 = 2"), r.latex());
    }

    @Test
    void constantsAreSubstituted() {
        ConversionResult r = new VCalcLatex().convert("r = 2\nA = pi * r**2");
        assertEquals(block("r &= 2", "\\\\[10pt]", "A &= pi \\cdot r^{2} = 3.14159 \\cdot 2^{2} = 12.5664"), r.latex());
    }

    @Test
    void complexResults() {
        ConversionResult r = new VCalcLatex().convert("z = 3 + 1j\nw = z * j");
        assertEquals(block("z &= 3 + 1j = 3 + j", "\\\\", "w &= z \\cdot j = 3 + j \\cdot j = -1 + 3j"), r.latex());
    }

    @Test
    void booleansAndConditionals() {
        ConversionResult r = new VCalcLatex().convert("a = 3\nb = 4\nok = a > b\nm = a if a > b else b");
        assertEquals("ok &= a > b = \\text{False}", r.latex().split("\n")[5]);
        assertEquals("m &= \\begin{cases} a & \\text{if } a > b \\\\ b & \\text{otherwise} \\end{cases} = 4",
                r.latex().split("\n")[7]);
    }

    @Test
    void injectedVariablesAreVisible() {
        Map<String, Value> existing = new LinkedHashMap<>();
        existing.put("x", Value.integer(21));
        ConversionResult r = new VCalcLatex().convert("y = x * 2", existing);
        assertEquals(block("y &= x \\cdot 2 = 21 \\cdot 2 = 42"), r.latex());
        assertEquals(Collections.singletonList("y"), new java.util.ArrayList<>(r.variables().keySet()));
        assertEquals(Value.integer(21), r.environment().get("x"));
    }

    @Test
    void variablesKeepFirstAssignmentOrderWithFinalValues() {
        ConversionResult r = new VCalcLatex().convert("a = 1\nb = 2\na += 5");
        assertEquals(Arrays.asList("a", "b"), new java.util.ArrayList<>(r.variables().keySet()));
        assertEquals(Value.integer(6), r.variables().get("a"));
        assertEquals(3, r.records().size());
    }

    @Test
    void renderOptionsApplyToEveryDerivedLine() {
        VCalcLatex engine = new VCalcLatex();
        engine.setRenderOptions(RenderOptions.defaults().withSubstitution(false));
        assertEquals(block("x &= 5", "\\\\[10pt]", "y &= x^{2} = 25"), engine.convert("x = 5\ny = x**2").latex());
        engine.setRenderOptions(null);
        assertEquals(RenderOptions.defaults(), engine.getRenderOptions());
    }

    @Test
    void customFunctions() {
        VCalcLatex engine = new VCalcLatex();
        engine.registerFunction("double", args -> Value.integer(args.get(0).asInt().multiply(BigInteger.TWO)));
        assertTrue(engine.hasFunction("double"));
        assertEquals(block("x &= \\text{double}\\left(21\\right) = 42"), engine.convert("x = double(21)").latex());
        assertThrows(IllegalArgumentException.class, () -> engine.registerFunction("", args -> Value.none()));
        assertThrows(IllegalArgumentException.class, () -> engine.registerFunction("f", null));
    }

    @Test
    void builtinRegistryIsPopulated() {
        VCalcLatex engine = new VCalcLatex();
        for (String name : new String[] { "sqrt", "sin", "log", "exp", "floor", "abs", "round", "max", "sum", "int" }) {
            assertTrue(engine.hasFunction(name), name);
        }
    }

    @Test
    void customEvaluatorReplacesInterpreter() {
        VCalcLatex engine = new VCalcLatex();
        engine.setEvaluator((stmt, env) -> Value.integer(42));
        ConversionResult r = engine.convert("a = 1\nb = a + unknown");
        assertEquals(Value.integer(42), r.variables().get("a"));
        assertEquals(Value.integer(42), r.variables().get("b"));
        engine.setEvaluator(null);
        assertEquals(1, engine.convert("a = 1\nb = a + unknown").records().size());
    }

    @Test
    void preParsedProgramAgainstCallerEnvironment() {
        VCalcLatex engine = new VCalcLatex();
        Environment env = new Environment();
        env.define("k", Value.integer(7));
        ConversionResult r = engine.convert(engine.parse("m = k * 3"), env);
        assertEquals(block("m &= k \\cdot 3 = 7 \\cdot 3 = 21"), r.latex());
        assertEquals(Value.integer(21), env.lookup("m"));
    }

    @Test
    void parseErrorsFailBeforeAnythingRuns() {
        VCalcLatex engine = new VCalcLatex();
        CalcParseException e = assertThrows(CalcParseException.class, () -> engine.convert("x = 1\ny = (2 +"));
        assertNotNull(e.getMessage());
        assertThrows(CalcParseException.class, () -> engine.convert("x = 1 $ 2"));
        assertThrows(CalcParseException.class, () -> engine.convert("x = 1\n  y = 2"));
    }

    @Test
    void deepNestingFailsPredictably() {
        StringBuilder src = new StringBuilder("x = ");
        for (int i = 0; i < 300; i++) src.append('(');
        src.append('1');
        for (int i = 0; i < 300; i++) src.append(')');

        VCalcLatex engine = new VCalcLatex();
        assertThrows(ExpressionDepthException.class, () -> engine.convert(src.toString()));

        engine.setMaxDepth(1000);
        assertEquals(block("x &= 1"), engine.convert(src.toString()).latex());
        assertThrows(IllegalArgumentException.class, () -> engine.setMaxDepth(0));
    }

    @Test
    void statementsRunInSourceOrder() {
        List<String> seen = new java.util.ArrayList<>();
        VCalcLatex engine = new VCalcLatex();
        engine.registerFunction("mark", args -> {
            seen.add(args.get(0).asString());
            return Value.integer(seen.size());
        });
        engine.convert("a = mark('a')\nb = mark('b')\nc = mark('c')");
        assertEquals(Arrays.asList("a", "b", "c"), seen);
    }
}
