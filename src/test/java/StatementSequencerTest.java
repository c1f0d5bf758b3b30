import org.junit.jupiter.api.Test;

import com.vcalc.latex.AssignmentRecord;
import com.vcalc.latex.EvaluationException;
import com.vcalc.latex.ExpressionDepthException;
import com.vcalc.latex.StatementSequencer;
import com.vcalc.latex.VCalcLatex;
import com.vcalc.latex.parser.Environment;
import com.vcalc.latex.parser.Value;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatementSequencerTest {

    private final VCalcLatex engine = new VCalcLatex();

    private List<AssignmentRecord> run(String source, Environment env) {
        return new StatementSequencer(engine.newInterpreter()).run(engine.parse(source), env);
    }

    @Test
    void recordsFollowSourceOrder() {
        Environment env = Environment.withDefaults();
        List<AssignmentRecord> records = run("a = 1\nb = a + 1\na = b * 3", env);
        assertEquals(3, records.size());
        assertEquals("a", records.get(0).target());
        assertEquals("b", records.get(1).target());
        assertEquals("a", records.get(2).target());
        assertEquals(Value.integer(6), env.lookup("a"));
        assertEquals(3, records.get(2).line());
    }

    @Test
    void trivialityIsDecidedByTheStatementShape() {
        List<AssignmentRecord> records = run("a = 1\nb = -1\nc = 'x'\nd = a\na += 2", Environment.withDefaults());
        assertTrue(records.get(0).trivial());
        assertFalse(records.get(1).trivial());
        assertTrue(records.get(2).trivial());
        assertFalse(records.get(3).trivial());
        assertTrue(records.get(4).trivial());
        assertNull(records.get(4).expression());
    }

    @Test
    void scopeIsTheEnvironmentAfterTheStatement() {
        List<AssignmentRecord> records = run("x = 1\nx = x + 1\ny = 0", Environment.withDefaults());
        AssignmentRecord second = records.get(1);
        assertEquals(Value.integer(2), second.scope().lookup("x"));
        assertEquals(Value.integer(2), second.value());
        assertEquals(Value.integer(1), records.get(0).scope().lookup("x"));
        assertFalse(second.scope().exists("y"));
    }

    @Test
    void failedStatementLeavesNoTrace() {
        Environment env = Environment.withDefaults();
        env.define("x", Value.integer(4));
        List<AssignmentRecord> records = run("x = 1 / 0\ny = undefined\nz = x", env);
        assertEquals(1, records.size());
        assertEquals(Value.integer(4), env.lookup("x"));
        assertFalse(env.exists("y"));
        assertEquals(Value.integer(4), env.lookup("z"));
    }

    @Test
    void nonNameTargetsAndOtherStatementsAreNotEvaluated() {
        List<String> seen = new ArrayList<>();
        StatementSequencer sequencer = new StatementSequencer((stmt, env) -> {
            seen.add("line " + stmt.line());
            return Value.integer(0);
        });
        List<AssignmentRecord> records = sequencer.run(engine.parse(
                "a, b = 1, 2\nxs[0] = 1\nimport math\nprint(a)\nc = d = 3\nok = 1"), Environment.withDefaults());
        assertEquals(1, records.size());
        assertEquals("ok", records.get(0).target());
        assertEquals(List.of("line 6"), seen);
    }

    @Test
    void evaluatorErrorsDropOnlyThatStatement() {
        StatementSequencer sequencer = new StatementSequencer((stmt, env) -> {
            if (stmt.line() == 1) throw new EvaluationException("boom");
            return Value.integer(stmt.line());
        });
        List<AssignmentRecord> records = sequencer.run(engine.parse("a = 1\nb = 2"), Environment.withDefaults());
        assertEquals(1, records.size());
        assertEquals(Value.integer(2), records.get(0).value());
    }

    @Test
    void anyRuntimeFailureDropsOnlyThatStatement() {
        StatementSequencer sequencer = new StatementSequencer((stmt, env) -> {
            if (stmt.line() == 2) throw new IllegalStateException("host failure");
            return Value.integer(stmt.line());
        });
        List<AssignmentRecord> records = sequencer.run(engine.parse("a = 1\nb = 2\nc = 3"), Environment.withDefaults());
        assertEquals(2, records.size());
        assertEquals("a", records.get(0).target());
        assertEquals("c", records.get(1).target());
    }

    @Test
    void depthFailureStopsTheRun() {
        StatementSequencer sequencer = new StatementSequencer((stmt, env) -> {
            throw new ExpressionDepthException("evaluator", 3);
        });
        assertThrows(ExpressionDepthException.class,
                () -> sequencer.run(engine.parse("a = 1"), Environment.withDefaults()));
    }

    @Test
    void requiresAnEvaluator() {
        assertThrows(IllegalArgumentException.class, () -> new StatementSequencer(null));
    }
}
