package com.vcalc.latex.render;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Variable name to LaTeX: Greek letter names become their commands and the
 * first underscore starts a subscript ({@code Gamma_L} is {@code \Gamma_{L}}).
 *
 * {@code pi} and {@code e} stay as they are: in calculations they are the
 * constants, not Greek letters.
 */
public final class IdentifierRenderer {

    private static final Map<String, String> SYMBOLS;
    static {
        Map<String, String> m = new HashMap<>();
        m.put("alpha", "\\alpha");
        m.put("beta", "\\beta");
        m.put("gamma", "\\gamma");
        m.put("Gamma", "\\Gamma");
        m.put("delta", "\\delta");
        m.put("Delta", "\\Delta");
        m.put("epsilon", "\\epsilon");
        m.put("varepsilon", "\\varepsilon");
        m.put("zeta", "\\zeta");
        m.put("eta", "\\eta");
        m.put("theta", "\\theta");
        m.put("Theta", "\\Theta");
        m.put("vartheta", "\\vartheta");
        m.put("iota", "\\iota");
        m.put("kappa", "\\kappa");
        m.put("lambda", "\\lambda");
        m.put("Lambda", "\\Lambda");
        m.put("mu", "\\mu");
        m.put("nu", "\\nu");
        m.put("xi", "\\xi");
        m.put("Xi", "\\Xi");
        m.put("Pi", "\\Pi");
        m.put("varpi", "\\varpi");
        m.put("rho", "\\rho");
        m.put("varrho", "\\varrho");
        m.put("sigma", "\\sigma");
        m.put("Sigma", "\\Sigma");
        m.put("varsigma", "\\varsigma");
        m.put("tau", "\\tau");
        m.put("upsilon", "\\upsilon");
        m.put("Upsilon", "\\Upsilon");
        m.put("phi", "\\phi");
        m.put("Phi", "\\Phi");
        m.put("varphi", "\\varphi");
        m.put("chi", "\\chi");
        m.put("psi", "\\psi");
        m.put("Psi", "\\Psi");
        m.put("omega", "\\omega");
        m.put("Omega", "\\Omega");
        // engineering shorthands
        m.put("ohm", "\\Omega");
        m.put("inf", "\\infty");
        SYMBOLS = Collections.unmodifiableMap(m);
    }

    private IdentifierRenderer() {}

    public static String render(String name) {
        int underscore = name.indexOf('_');
        if (underscore >= 0) {
            String base = name.substring(0, underscore);
            String subscript = name.substring(underscore + 1);
            return symbol(base) + "_{" + symbol(subscript) + "}";
        }
        return symbol(name);
    }

    /** The LaTeX command for a Greek letter name (case-sensitive), else the text itself. */
    public static String symbol(String text) {
        return SYMBOLS.getOrDefault(text, text);
    }
}
