import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.vcalc.debug.Debug;
import com.vcalc.debug.DebugLevel;
import com.vcalc.debug.DebugSink;
import com.vcalc.latex.VCalcLatex;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    private DebugSink saved;

    @BeforeEach
    void save() {
        saved = Debug.get().getSink();
    }

    @AfterEach
    void restore() {
        Debug.get().setSink(saved);
    }

    @Test
    void droppedStatementsAreLoggedWithTheirLine() {
        List<String> lines = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> lines.add(level + " " + tag + " " + message));

        new VCalcLatex().convert("x = 1 / 0\nimport math\ny = 2");

        assertTrue(lines.contains("DEBUG vcalc.sequencer line 1: dropped 'x': division by zero"), lines.toString());
        assertTrue(lines.contains("DEBUG vcalc.sequencer line 2: skipped import statement"), lines.toString());
        assertTrue(lines.contains("INFO vcalc.engine converted 3 statement(s) into 1 line(s)"), lines.toString());
    }

    @Test
    void printingSinkFiltersByLevel() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        Debug.get().setSink(Debug.printing(out, DebugLevel.WARN));

        Debug.get().d("t", "hidden");
        Debug.get().i("t", "hidden too");
        Debug.get().w("t", "shown");

        assertEquals("[WARN][t] shown" + System.lineSeparator(), buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void nullSinkSilencesOutput() {
        Debug.get().setSink(null);
        assertDoesNotThrow(() -> Debug.get().w("t", "nowhere", new RuntimeException("x")));
        assertNotNull(Debug.get().getSink());
    }

    @Test
    void levelsAreOrdered() {
        assertTrue(DebugLevel.ERROR.atLeast(DebugLevel.WARN));
        assertFalse(DebugLevel.DEBUG.atLeast(DebugLevel.INFO));
        assertTrue(DebugLevel.DEBUG.atLeast(null));
    }
}
