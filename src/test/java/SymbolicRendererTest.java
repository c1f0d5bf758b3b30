import org.junit.jupiter.api.Test;

import com.vcalc.latex.ExpressionDepthException;
import com.vcalc.latex.parser.Expr;
import com.vcalc.latex.parser.Parser;
import com.vcalc.latex.parser.Statement;
import com.vcalc.latex.render.SymbolicRenderer;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolicRendererTest {

    static Expr.ExprInterface expr(String source) {
        Statement.Stmt stmt = Parser.parse("x = " + source, Parser.DEFAULT_MAX_DEPTH).get(0);
        return ((Statement.AssignStmt) stmt).value;
    }

    private static String render(String source) {
        return new SymbolicRenderer().render(expr(source));
    }

    @Test
    void arithmeticOperators() {
        assertEquals("a + b", render("a + b"));
        assertEquals("a - b", render("a - b"));
        assertEquals("a \\cdot b", render("a * b"));
        assertEquals("\\frac{a}{b}", render("a / b"));
        assertEquals("\\left\\lfloor\\frac{a}{b}\\right\\rfloor", render("a // b"));
        assertEquals("a^{2}", render("a ** 2"));
        assertEquals("a \\mod b", render("a % b"));
    }

    @Test
    void additiveOperandsAreParenthesized() {
        assertEquals("\\left(a + b\\right) \\cdot c", render("(a + b) * c"));
        assertEquals("a \\cdot \\left(b + c\\right)", render("a * (b + c)"));
        assertEquals("\\left(a - b\\right)^{2}", render("(a - b) ** 2"));
        assertEquals("a^{\\left(b + 1\\right)}", render("a ** (b + 1)"));
    }

    @Test
    void fractionDenominatorIsNeverParenthesized() {
        assertEquals("\\frac{\\left(a + b\\right)}{c}", render("(a + b) / c"));
        assertEquals("\\frac{a}{b + c}", render("a / (b + c)"));
    }

    @Test
    void nonAdditiveOperandsStayBare() {
        assertEquals("a \\cdot b \\cdot c", render("a * b * c"));
        assertEquals("\\frac{a \\cdot b}{c}", render("a * b / c"));
        assertEquals("a + b \\cdot c", render("a + b * c"));
    }

    @Test
    void operatorsWithoutTemplateUseTextMarker() {
        assertEquals("a \\text{op} b", render("a & b"));
        assertEquals("a \\text{op} 2", render("a << 2"));
    }

    @Test
    void unaryOperators() {
        assertEquals("-x", render("-x"));
        assertEquals("+x", render("+x"));
        assertEquals("\\neg y", render("not y"));
        assertEquals("y", render("~y"));
        assertEquals("-a^{2}", render("-a ** 2"));
    }

    @Test
    void literals() {
        assertEquals("3", render("3"));
        assertEquals("2.5", render("2.5"));
        assertEquals("0.333333", render("0.3333333333"));
        assertEquals("1e+100", render("1e100"));
        assertEquals("\\infty", render("1e400"));
        assertEquals("2j", render("2j"));
        assertEquals("True", render("True"));
        assertEquals("None", render("None"));
        assertEquals("volts", render("'volts'"));
    }

    @Test
    void identifiersGoThroughIdentifierRenderer() {
        assertEquals("\\alpha_{1} \\cdot \\omega", render("alpha_1 * omega"));
        assertEquals("V_{in}^{2}", render("V_in ** 2"));
    }

    @Test
    void functionTemplates() {
        assertEquals("\\sqrt{x}", render("sqrt(x)"));
        assertEquals("\\left|x\\right|", render("abs(x)"));
        assertEquals("\\sin\\left(\\theta\\right)", render("sin(theta)"));
        assertEquals("\\cosh\\left(x\\right)", render("cosh(x)"));
        assertEquals("\\arcsin\\left(x\\right)", render("asin(x)"));
        assertEquals("\\arccos\\left(x\\right)", render("arccos(x)"));
        assertEquals("\\arctan\\left(x\\right)", render("atan(x)"));
        assertEquals("\\arctan\\left(\\frac{y}{x}\\right)", render("atan2(y, x)"));
        assertEquals("\\ln\\left(x\\right)", render("log(x)"));
        assertEquals("\\log_{2}\\left(x\\right)", render("log(x, 2)"));
        assertEquals("\\log_{10}\\left(x\\right)", render("log10(x)"));
        assertEquals("\\log_{2}\\left(x\\right)", render("log2(x)"));
        assertEquals("e^{x}", render("exp(x)"));
        assertEquals("a^{b}", render("pow(a, b)"));
        assertEquals("\\max\\left(a, b, c\\right)", render("max(a, b, c)"));
        assertEquals("\\min\\left(a, b\\right)", render("min(a, b)"));
        assertEquals("\\sum xs", render("sum(xs)"));
        assertEquals("x", render("round(x, 2)"));
    }

    @Test
    void moduleCallsUseTheAttributeName() {
        assertEquals("\\sqrt{x}", render("math.sqrt(x)"));
        assertEquals("\\sin\\left(x\\right)", render("np.sin(x)"));
    }

    @Test
    void unknownFunctionsAndShortArgumentListsAreGeneric() {
        assertEquals("\\text{foo\\_bar}\\left(x, y\\right)", render("foo_bar(x, y)"));
        assertEquals("\\text{atan2}\\left(y\\right)", render("atan2(y)"));
        assertEquals("\\text{sqrt}\\left(\\right)", render("sqrt()"));
    }

    @Test
    void comparisons() {
        assertEquals("a = b", render("a == b"));
        assertEquals("a \\neq b", render("a != b"));
        assertEquals("a < b \\leq c", render("a < b <= c"));
        assertEquals("a > b \\geq c", render("a > b >= c"));
        assertEquals("a \\in xs", render("a in xs"));
        assertEquals("a \\notin xs", render("a not in xs"));
        assertEquals("a \\equiv None", render("a is None"));
        assertEquals("a \\not\\equiv None", render("a is not None"));
    }

    @Test
    void conditionalRendersCases() {
        assertEquals("\\begin{cases} a & \\text{if } a > b \\\\ b & \\text{otherwise} \\end{cases}",
                render("a if a > b else b"));
    }

    @Test
    void indexing() {
        assertEquals("xs_{0}", render("xs[0]"));
        assertEquals("xs_{i}", render("xs[i]"));
        assertEquals("d_{k}", render("d['k']"));
        assertEquals("xs_{i + 1}", render("xs[i + 1]"));
    }

    @Test
    void sequences() {
        assertEquals("\\left[1, x, 2.5\\right]", render("[1, x, 2.5]"));
        assertEquals("\\left[a, b\\right]", render("(a, b)"));
        assertEquals("\\left[\\right]", render("[]"));
    }

    @Test
    void nodesWithoutTemplateRenderUnknownMarker() {
        assertEquals("\\text{?}", render("a and b"));
        assertEquals("\\text{?}", render("z.real"));
        assertEquals("\\text{?}", render("{'a': 1}"));
        assertEquals("\\text{?} + 1", render("(a or b) + 1"));
    }

    @Test
    void depthIsBounded() {
        StringBuilder src = new StringBuilder("a");
        for (int i = 0; i < 10; i++) src.append(" + 1");
        Expr.ExprInterface deep = expr(src.toString());

        assertThrows(ExpressionDepthException.class, () -> new SymbolicRenderer(5).render(deep));
        assertDoesNotThrow(() -> new SymbolicRenderer(20).render(deep));
    }
}
