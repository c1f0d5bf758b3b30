package com.vcalc.latex.render;

import java.util.ArrayList;
import java.util.List;

import com.vcalc.latex.ExpressionDepthException;
import com.vcalc.latex.parser.Expr;
import com.vcalc.latex.parser.Expr.Attribute;
import com.vcalc.latex.parser.Expr.Binary;
import com.vcalc.latex.parser.Expr.Call;
import com.vcalc.latex.parser.Expr.Compare;
import com.vcalc.latex.parser.Expr.Conditional;
import com.vcalc.latex.parser.Expr.Index;
import com.vcalc.latex.parser.Expr.Literal;
import com.vcalc.latex.parser.Expr.Logical;
import com.vcalc.latex.parser.Expr.MapLiteral;
import com.vcalc.latex.parser.Expr.Sequence;
import com.vcalc.latex.parser.Expr.Unary;
import com.vcalc.latex.parser.Expr.Variable;
import com.vcalc.latex.parser.Parser;
import com.vcalc.latex.parser.Token;
import com.vcalc.latex.parser.Value;
import com.vcalc.latex.parser.utils.NumberText;

/**
 * Expression tree to LaTeX using variable names.
 *
 * Never fails on a well-formed tree: calls with too few arguments for their
 * template fall back to {@code \text{name}\left(...\right)} and node kinds
 * without a template render as {@code \text{?}}.
 */
public class SymbolicRenderer implements Expr.ExprVisitor<String> {

    private final int maxDepth;
    private int depth = 0;

    public SymbolicRenderer() {
        this(Parser.DEFAULT_MAX_DEPTH);
    }

    public SymbolicRenderer(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public String render(Expr.ExprInterface expr) {
        if (depth >= maxDepth) throw new ExpressionDepthException("symbolic renderer", maxDepth);
        depth++;
        try {
            return expr.accept(this);
        } finally {
            depth--;
        }
    }

    /** Literal text: {@code str()} of the value, reals as {@code %g}, infinities as {@code \infty}. */
    public static String literal(Object value) {
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Double.POSITIVE_INFINITY) return "\\infty";
            if (d == Double.NEGATIVE_INFINITY) return "-\\infty";
            return NumberText.general(d);
        }
        return Value.ofLiteral(value).toString();
    }

    @Override
    public String visitLiteralExpr(Literal expr) {
        return literal(expr.value);
    }

    @Override
    public String visitVariableExpr(Variable expr) {
        return IdentifierRenderer.render(expr.name.lexeme);
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        String left = render(expr.left);
        String right = render(expr.right);
        return LatexTemplates.binary(expr, left, right);
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        return LatexTemplates.unary(expr.operator.type, render(expr.right));
    }

    @Override
    public String visitCallExpr(Call expr) {
        String name = expr.name();
        List<String> args = new ArrayList<>();
        for (Expr.ExprInterface arg : expr.arguments) {
            args.add(render(arg));
        }
        String templated = function(name, args);
        return templated != null ? templated : LatexTemplates.generic(name, args);
    }

    private static String function(String name, List<String> args) {
        int n = args.size();
        if (n == 0) {
            return null;
        }
        String a0 = args.get(0);
        switch (name) {
            case "sqrt":
                return "\\sqrt{" + a0 + "}";
            case "abs":
                return "\\left|" + a0 + "\\right|";
            case "sin": case "cos": case "tan":
            case "cot": case "sec": case "csc":
            case "sinh": case "cosh": case "tanh":
                return LatexTemplates.command(name, a0);
            case "asin": case "arcsin":
                return LatexTemplates.command("arcsin", a0);
            case "acos": case "arccos":
                return LatexTemplates.command("arccos", a0);
            case "atan": case "arctan":
                return LatexTemplates.command("arctan", a0);
            case "atan2":
                if (n < 2) return null;
                return "\\arctan\\left(\\frac{" + a0 + "}{" + args.get(1) + "}\\right)";
            case "log":
                if (n == 1) return LatexTemplates.command("ln", a0);
                return "\\log_{" + args.get(1) + "}\\left(" + a0 + "\\right)";
            case "ln":
                return LatexTemplates.command("ln", a0);
            case "log10":
                return "\\log_{10}\\left(" + a0 + "\\right)";
            case "log2":
                return "\\log_{2}\\left(" + a0 + "\\right)";
            case "exp":
                return "e^{" + a0 + "}";
            case "pow":
                if (n < 2) return null;
                return a0 + "^{" + args.get(1) + "}";
            case "max":
            case "min":
                return "\\" + name + "\\left(" + String.join(", ", args) + "\\right)";
            case "sum":
                return "\\sum " + a0;
            case "round":
                // rounding does not show in the typeset form
                return a0;
            default:
                return null;
        }
    }

    @Override
    public String visitCompareExpr(Compare expr) {
        StringBuilder sb = new StringBuilder(render(expr.left));
        for (int i = 0; i < expr.operators.size(); i++) {
            String right = render(expr.comparators.get(i));
            sb.append(compareOperator(expr.operators.get(i))).append(right);
        }
        return sb.toString();
    }

    private static String compareOperator(Token op) {
        switch (op.type) {
            case EQUAL_EQUAL: return " = ";
            case BANG_EQUAL: return " \\neq ";
            case LESS: return " < ";
            case GREATER: return " > ";
            case LESS_EQUAL: return " \\leq ";
            case GREATER_EQUAL: return " \\geq ";
            case IN: return " \\in ";
            case NOT_IN: return " \\notin ";
            case IS: return " \\equiv ";
            case IS_NOT: return " \\not\\equiv ";
            default: return " " + LatexTemplates.UNKNOWN + " ";
        }
    }

    @Override
    public String visitConditionalExpr(Conditional expr) {
        String test = render(expr.test);
        String body = render(expr.thenBranch);
        String orElse = render(expr.elseBranch);
        return "\\begin{cases} " + body + " & \\text{if } " + test + " \\\\ "
                + orElse + " & \\text{otherwise} \\end{cases}";
    }

    @Override
    public String visitIndexExpr(Index expr) {
        String target = render(expr.target);
        String index = (expr.index instanceof Literal)
                ? Value.ofLiteral(((Literal) expr.index).value).toString()
                : render(expr.index);
        return target + "_{" + index + "}";
    }

    @Override
    public String visitSequenceExpr(Sequence expr) {
        List<String> items = new ArrayList<>();
        for (Expr.ExprInterface e : expr.elements) {
            items.add(render(e));
        }
        return "\\left[" + String.join(", ", items) + "\\right]";
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        return LatexTemplates.UNKNOWN;
    }

    @Override
    public String visitAttributeExpr(Attribute expr) {
        return LatexTemplates.UNKNOWN;
    }

    @Override
    public String visitMapLiteralExpr(MapLiteral expr) {
        return LatexTemplates.UNKNOWN;
    }
}
