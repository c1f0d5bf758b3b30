import org.junit.jupiter.api.Test;

import com.vcalc.latex.EvaluationException;
import com.vcalc.latex.VCalcLatex;
import com.vcalc.latex.parser.Environment;
import com.vcalc.latex.parser.Value;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class MathPluginTest {

    private final VCalcLatex engine = new VCalcLatex();

    private Value eval(String source) {
        return engine.newInterpreter().evaluate(SymbolicRendererTest.expr(source), Environment.withDefaults());
    }

    private double real(String source) {
        Value v = eval(source);
        assertEquals(Value.Type.REAL, v.type, source + " -> " + v.repr());
        return v.asReal();
    }

    @Test
    void registersTheMathModule() {
        for (String name : new String[] {
                "sqrt", "sin", "cos", "tan", "asin", "acos", "atan", "atan2", "sinh", "cosh", "tanh",
                "exp", "log", "log10", "log2", "floor", "ceil", "degrees", "radians", "hypot" }) {
            assertTrue(engine.hasFunction(name), name);
        }
    }

    @Test
    void resultsAreFloats() {
        assertEquals(4.0, real("sqrt(16)"));
        assertEquals(0.0, real("sin(0)"));
        assertEquals(1.0, real("cos(False)"));
        assertEquals(Math.PI / 4, real("atan2(1, 1)"));
        assertEquals(180.0, real("degrees(pi)"));
        assertEquals(Math.PI, real("radians(180)"));
        assertEquals(13.0, real("hypot(3, 4, 12)"));
        assertEquals(0.0, real("hypot()"));
    }

    @Test
    void logarithms() {
        assertEquals(3.0, real("log(8, 2)"), 1e-12);
        assertEquals(1.0, real("log(e)"));
        assertEquals(3.0, real("log2(8)"));
        assertEquals(3.0, real("log10(1000)"));
        assertEquals(1386.2943611198907, real("log(2 ** 2000)"), 1e-9);
        assertThrows(EvaluationException.class, () -> eval("log(0)"));
        assertThrows(EvaluationException.class, () -> eval("log10(-1)"));
        assertThrows(EvaluationException.class, () -> eval("log(8, 1)"));
    }

    @Test
    void floorAndCeilReturnInts() {
        assertEquals(Value.integer(2), eval("floor(2.5)"));
        assertEquals(Value.Type.INT, eval("floor(2.5)").type);
        assertEquals(Value.integer(-3), eval("floor(-2.5)"));
        assertEquals(Value.integer(3), eval("ceil(2.1)"));
        assertEquals(Value.integer(BigInteger.TEN.pow(30)), eval("floor(10 ** 30)"));
        assertThrows(EvaluationException.class, () -> eval("floor(inf)"));
        assertThrows(EvaluationException.class, () -> eval("ceil(nan)"));
    }

    @Test
    void domainAndRangeErrors() {
        EvaluationException domain = assertThrows(EvaluationException.class, () -> eval("sqrt(-1)"));
        assertEquals("math domain error", domain.getMessage());
        EvaluationException range = assertThrows(EvaluationException.class, () -> eval("exp(1000)"));
        assertEquals("math range error", range.getMessage());
        assertThrows(EvaluationException.class, () -> eval("asin(2)"));
        // inf in, inf out
        assertEquals(Double.POSITIVE_INFINITY, real("exp(inf)"));
    }

    @Test
    void argumentChecks() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("sqrt(1, 2)"));
        assertEquals("sqrt() takes exactly 1 argument (2 given)", e.getMessage());
        assertThrows(EvaluationException.class, () -> eval("sqrt('4')"));
        assertThrows(EvaluationException.class, () -> eval("sqrt(1j)"));
        assertThrows(EvaluationException.class, () -> eval("log()"));
    }
}
