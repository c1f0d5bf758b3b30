import org.junit.jupiter.api.Test;

import com.vcalc.latex.EvaluationException;
import com.vcalc.latex.VCalcLatex;
import com.vcalc.latex.parser.Environment;
import com.vcalc.latex.parser.Interpreter;
import com.vcalc.latex.parser.Value;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class InterpreterTest {

    private final Interpreter interpreter = new VCalcLatex().newInterpreter();

    private Value eval(String source) {
        return eval(source, Environment.withDefaults());
    }

    private Value eval(String source, Environment env) {
        return interpreter.evaluate(SymbolicRendererTest.expr(source), env);
    }

    private void assertReal(double expected, Value v) {
        assertEquals(Value.Type.REAL, v.type, v.repr());
        assertEquals(expected, v.asReal(), 0.0);
    }

    private void assertInt(long expected, Value v) {
        assertEquals(Value.Type.INT, v.type, v.repr());
        assertEquals(BigInteger.valueOf(expected), v.asInt());
    }

    @Test
    void divisionFollowsPython() {
        assertReal(3.5, eval("7 / 2"));
        assertReal(2.0, eval("4 / 2"));
        assertInt(3, eval("7 // 2"));
        assertInt(-4, eval("-7 // 2"));
        assertReal(-4.0, eval("-7.0 // 2"));
        assertInt(2, eval("-7 % 3"));
        assertInt(-2, eval("7 % -3"));
        assertReal(-0.5, eval("7.5 % -2"));
        assertReal(10.0, eval("10 ** 400 / 10 ** 399"));
    }

    @Test
    void divisionByZeroRaises() {
        assertThrows(EvaluationException.class, () -> eval("1 / 0"));
        assertThrows(EvaluationException.class, () -> eval("1 // 0"));
        assertThrows(EvaluationException.class, () -> eval("1 % 0"));
        assertThrows(EvaluationException.class, () -> eval("1.0 / 0.0"));
    }

    @Test
    void powers() {
        assertReal(0.5, eval("2 ** -1"));
        assertInt(-4, eval("-2 ** 2"));
        assertInt(512, eval("2 ** 3 ** 2"));
        assertEquals(BigInteger.ONE.shiftLeft(100), eval("2 ** 100").asInt());
        assertReal(Math.sqrt(2.0), eval("2 ** 0.5"));
        assertEquals(Value.Type.COMPLEX, eval("(-8) ** (1 / 3)").type);
        assertThrows(EvaluationException.class, () -> eval("0 ** -1"));
    }

    @Test
    void boolsAreInts() {
        assertInt(2, eval("True + 1"));
        assertInt(0, eval("False * 3"));
        assertEquals(Value.bool(true), eval("1 == 1.0"));
        assertEquals(Value.bool(false), eval("True & False"));
        assertInt(1, eval("5 & 3"));
        assertInt(8, eval("1 << 3"));
        assertInt(-6, eval("~5"));
    }

    @Test
    void sequencesAndStrings() {
        assertEquals(Value.string("abab"), eval("'ab' * 2"));
        assertEquals("[1, 2, 3]", eval("[1, 2] + [3]").repr());
        assertEquals("(1, 2)", eval("(1,) + (2,)").repr());
        assertInt(3, eval("[1, 2, 3][-1]"));
        assertEquals(Value.string("b"), eval("'abc'[1]"));
        assertEquals(Value.string("a"), eval("{1: 'a'}[1.0]"));
        assertThrows(EvaluationException.class, () -> eval("[1, 2][2]"));
        assertThrows(EvaluationException.class, () -> eval("{'a': 1}['b']"));
        assertThrows(EvaluationException.class, () -> eval("'a' + 1"));
        assertThrows(EvaluationException.class, () -> eval("{[1]: 2}"));
    }

    @Test
    void comparisonsChain() {
        assertEquals(Value.bool(true), eval("1 < 2 < 3"));
        assertEquals(Value.bool(false), eval("3 > 2 > 5"));
        assertEquals(Value.bool(true), eval("'b' in 'abc'"));
        assertEquals(Value.bool(true), eval("4 not in [1, 2]"));
        assertEquals(Value.bool(true), eval("None is None"));
        assertEquals(Value.bool(false), eval("1 is 1.0"));
        assertEquals(Value.bool(false), eval("nan == nan"));
        assertEquals(Value.bool(false), eval("nan < 1"));
        assertThrows(EvaluationException.class, () -> eval("(1 + 2j) < 3"));
    }

    @Test
    void nanIsUnequalToItselfButContainersCheckIdentityFirst() {
        assertEquals(Value.bool(false), eval("nan == nan"));
        assertEquals(Value.bool(true), eval("nan != nan"));
        assertEquals(Value.bool(true), eval("nan is nan"));
        assertEquals(Value.bool(true), eval("[nan] == [nan]"));
        assertEquals(Value.bool(true), eval("(1, nan) == (1, nan)"));
        assertEquals(Value.bool(true), eval("nan in [1, nan]"));
        assertEquals(Value.bool(false), eval("[nan] == [float('nan')]"));
        assertEquals(Value.bool(true), eval("{'k': nan} == {'k': nan}"));
    }

    @Test
    void logicalOperatorsReturnOperands() {
        assertInt(5, eval("0 or 5"));
        assertInt(0, eval("0 and 5"));
        assertEquals(Value.bool(true), eval("not []"));
        assertInt(2, eval("1 if 0 else 2"));
        // the right side is never evaluated
        assertInt(1, eval("1 or undefined_name"));
    }

    @Test
    void namesResolveFromTheEnvironment() {
        Environment env = Environment.withDefaults();
        env.define("r", Value.integer(2));
        assertReal(Math.PI * 4, eval("pi * r ** 2", env));
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("q + 1", env));
        assertEquals("name 'q' is not defined", e.getMessage());
    }

    @Test
    void functionCalls() {
        assertReal(4.0, eval("sqrt(16)"));
        assertReal(4.0, eval("math.sqrt(16)"));
        assertReal(4.0, eval("np.sqrt(16)"));

        Environment env = Environment.withDefaults();
        env.define("f", eval("sqrt"));
        assertEquals(Value.Type.FUNC, env.lookup("f").type);
        assertReal(3.0, eval("f(9)", env));

        assertThrows(EvaluationException.class, () -> eval("sqrt(x=4)"));
        assertThrows(EvaluationException.class, () -> eval("nosuch(1)"));
    }

    @Test
    void variableShadowsBuiltinAndIsNotCallable() {
        Environment env = Environment.withDefaults();
        env.define("sqrt", Value.integer(3));
        assertInt(3, eval("sqrt", env));
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("sqrt(9)", env));
        assertEquals("'int' object is not callable", e.getMessage());
    }

    @Test
    void complexNumbers() {
        Environment env = Environment.withDefaults();
        env.define("z", eval("3 + 4j"));
        assertReal(3.0, eval("z.real", env));
        assertReal(4.0, eval("z.imag", env));
        assertEquals("(-4+3j)", eval("z * j", env).repr());
        assertInt(0, eval("5 .imag"));
        assertThrows(EvaluationException.class, () -> eval("'abc'.real"));
    }

    @Test
    void augmentedAssignmentUsesTheCurrentValue() {
        Environment env = Environment.withDefaults();
        env.define("n", Value.integer(10));
        Value v = interpreter.evaluate(new VCalcLatex().parse("n -= 3").get(0), env);
        assertInt(7, v);
        assertThrows(EvaluationException.class,
                () -> interpreter.evaluate(new VCalcLatex().parse("m += 1").get(0), env));
    }
}
