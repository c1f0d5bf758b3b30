import org.junit.jupiter.api.Test;

import com.vcalc.latex.render.IdentifierRenderer;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifierRendererTest {

    @Test
    void plainNamesPassThrough() {
        assertEquals("x", IdentifierRenderer.render("x"));
        assertEquals("velocity", IdentifierRenderer.render("velocity"));
    }

    @Test
    void greekNamesAreCaseSensitive() {
        assertEquals("\\alpha", IdentifierRenderer.render("alpha"));
        assertEquals("\\Gamma", IdentifierRenderer.render("Gamma"));
        assertEquals("\\gamma", IdentifierRenderer.render("gamma"));
        assertEquals("ALPHA", IdentifierRenderer.render("ALPHA"));
    }

    @Test
    void firstUnderscoreStartsSubscript() {
        assertEquals("\\Gamma_{L}", IdentifierRenderer.render("Gamma_L"));
        assertEquals("V_{in}", IdentifierRenderer.render("V_in"));
        assertEquals("\\omega_{\\theta}", IdentifierRenderer.render("omega_theta"));
        assertEquals("R_{load_max}", IdentifierRenderer.render("R_load_max"));
    }

    @Test
    void shorthandsAndConstants() {
        assertEquals("\\infty", IdentifierRenderer.render("inf"));
        assertEquals("\\Omega", IdentifierRenderer.render("ohm"));
        assertEquals("\\lambda", IdentifierRenderer.render("lambda"));
        // the constants are not Greek letters here
        assertEquals("pi", IdentifierRenderer.render("pi"));
        assertEquals("e", IdentifierRenderer.render("e"));
    }

    @Test
    void oddInputsNeverFail() {
        assertEquals("", IdentifierRenderer.render(""));
        assertEquals("_{}", IdentifierRenderer.render("_"));
        assertEquals("x_{}", IdentifierRenderer.render("x_"));
        assertEquals("_{x}", IdentifierRenderer.render("_x"));
    }
}
