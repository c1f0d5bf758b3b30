package com.vcalc.latex.render;

import java.util.ArrayList;
import java.util.List;

import com.vcalc.latex.ExpressionDepthException;
import com.vcalc.latex.parser.Environment;
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
import com.vcalc.latex.parser.Value;

/**
 * Expression tree to LaTeX with every bound name replaced by its formatted value.
 *
 * Arithmetic and a handful of functions are substituted; comparisons,
 * conditionals, indexing and sequences are handed to the symbolic renderer
 * as a whole.
 */
public class SubstitutionRenderer implements Expr.ExprVisitor<String> {

    private final Environment env;
    private final SymbolicRenderer symbolic;
    private final int maxDepth;
    private int depth = 0;

    public SubstitutionRenderer(Environment env) {
        this(env, Parser.DEFAULT_MAX_DEPTH);
    }

    public SubstitutionRenderer(Environment env, int maxDepth) {
        this.env = env;
        this.maxDepth = maxDepth;
        this.symbolic = new SymbolicRenderer(maxDepth);
    }

    public String render(Expr.ExprInterface expr) {
        if (depth >= maxDepth) throw new ExpressionDepthException("substitution renderer", maxDepth);
        depth++;
        try {
            return expr.accept(this);
        } finally {
            depth--;
        }
    }

    @Override
    public String visitLiteralExpr(Literal expr) {
        return SymbolicRenderer.literal(expr.value);
    }

    @Override
    public String visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        Value v = env.lookup(name);
        if (v == null || v.type == Value.Type.NONE) return IdentifierRenderer.render(name);
        return ValueFormatter.format(v);
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
        if (args.isEmpty()) return LatexTemplates.generic(name, args);

        String a0 = args.get(0);
        switch (name) {
            case "sqrt":
                return "\\sqrt{" + a0 + "}";
            case "abs":
                return "\\left|" + a0 + "\\right|";
            case "sin":
            case "cos":
            case "tan":
            case "log":
            case "exp":
                return LatexTemplates.command(name, a0);
            default:
                return LatexTemplates.generic(name, args);
        }
    }

    @Override
    public String visitCompareExpr(Compare expr) {
        return symbolic.render(expr);
    }

    @Override
    public String visitConditionalExpr(Conditional expr) {
        return symbolic.render(expr);
    }

    @Override
    public String visitIndexExpr(Index expr) {
        return symbolic.render(expr);
    }

    @Override
    public String visitSequenceExpr(Sequence expr) {
        return symbolic.render(expr);
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        return symbolic.render(expr);
    }

    @Override
    public String visitAttributeExpr(Attribute expr) {
        return symbolic.render(expr);
    }

    @Override
    public String visitMapLiteralExpr(MapLiteral expr) {
        return symbolic.render(expr);
    }
}
