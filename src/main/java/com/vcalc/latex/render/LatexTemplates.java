package com.vcalc.latex.render;

import java.util.List;

import com.vcalc.latex.parser.Expr;
import com.vcalc.latex.parser.TokenType;

/** Operator templates shared by the symbolic and the substituted rendering. */
final class LatexTemplates {

    static final String UNKNOWN = "\\text{?}";

    private LatexTemplates() {}

    /**
     * An additive operand of {@code * / **} is wrapped in {@code \left( \right)},
     * except the denominator of a fraction.
     */
    static String binary(Expr.Binary node, String left, String right) {
        TokenType op = node.operator.type;
        boolean tight = op == TokenType.STAR || op == TokenType.SLASH || op == TokenType.DOUBLE_STAR;
        if (tight && isAdditive(node.left)) left = "\\left(" + left + "\\right)";
        if (tight && op != TokenType.SLASH && isAdditive(node.right)) right = "\\left(" + right + "\\right)";

        switch (op) {
            case PLUS: return left + " + " + right;
            case MINUS: return left + " - " + right;
            case STAR: return left + " \\cdot " + right;
            case SLASH: return "\\frac{" + left + "}{" + right + "}";
            case DOUBLE_SLASH: return "\\left\\lfloor\\frac{" + left + "}{" + right + "}\\right\\rfloor";
            case DOUBLE_STAR: return left + "^{" + right + "}";
            case PERCENT: return left + " \\mod " + right;
            default: return left + " \\text{op} " + right;
        }
    }

    private static boolean isAdditive(Expr.ExprInterface node) {
        if (!(node instanceof Expr.Binary)) return false;
        TokenType op = ((Expr.Binary) node).operator.type;
        return op == TokenType.PLUS || op == TokenType.MINUS;
    }

    static String unary(TokenType op, String operand) {
        switch (op) {
            case MINUS: return "-" + operand;
            case PLUS: return "+" + operand;
            case NOT: return "\\neg " + operand;
            default: return operand;
        }
    }

    /** {@code \text{name}\left(a0, a1\right)}. */
    static String generic(String name, List<String> args) {
        return "\\text{" + name.replace("_", "\\_") + "}\\left(" + String.join(", ", args) + "\\right)";
    }

    /** {@code \name\left(a0\right)}. */
    static String command(String command, String arg) {
        return "\\" + command + "\\left(" + arg + "\\right)";
    }
}
