package com.vcalc.latex.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.vcalc.latex.EvaluationException;
import com.vcalc.latex.ExpressionDepthException;
import com.vcalc.latex.VCalcLatex;
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
import com.vcalc.latex.parser.Statement.AssignStmt;
import com.vcalc.latex.parser.Statement.AugAssignStmt;
import com.vcalc.latex.parser.Statement.OtherStmt;

/**
 * Constant-folding interpreter: evaluates the right-hand side of one
 * assignment against a read-only environment.
 *
 * Function calls resolve through the engine's builtin registry. A name bound
 * in the environment shadows a builtin of the same name.
 */
public class Interpreter implements Evaluator, Expr.ExprVisitor<Value>, Statement.StmtVisitor<Value> {

    private final Map<String, VCalcLatex.BuiltinFunction> functions;
    private int maxDepth = Parser.DEFAULT_MAX_DEPTH;

    private Environment env;
    private int depth = 0;

    public Interpreter(Map<String, VCalcLatex.BuiltinFunction> functions) {
        this.functions = functions;
    }

    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
    }

    @Override
    public Value evaluate(Statement.Stmt stmt, Environment env) {
        Environment saved = this.env;
        this.env = env;
        depth = 0;
        try {
            return stmt.accept(this);
        } catch (ArithmeticException e) {
            throw new EvaluationException(e.getMessage(), e);
        } finally {
            this.env = saved;
        }
    }

    /** Evaluates a bare expression (used by tests and the variable injector). */
    public Value evaluate(Expr.ExprInterface expr, Environment env) {
        Environment saved = this.env;
        this.env = env;
        depth = 0;
        try {
            return eval(expr);
        } catch (ArithmeticException e) {
            throw new EvaluationException(e.getMessage(), e);
        } finally {
            this.env = saved;
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Value visitAssignStmt(AssignStmt stmt) {
        if (stmt.simpleTarget() == null) {
            throw new EvaluationException("only single-name assignment targets are evaluated");
        }
        return eval(stmt.value);
    }

    @Override
    public Value visitAugAssignStmt(AugAssignStmt stmt) {
        String name = stmt.simpleTarget();
        if (name == null) {
            throw new EvaluationException("only single-name assignment targets are evaluated");
        }
        Value current = env.get(name);
        Value operand = eval(stmt.value);
        return Arithmetic.binary(stmt.operator.type.binaryOf(), current, operand);
    }

    @Override
    public Value visitOtherStmt(OtherStmt stmt) {
        throw new EvaluationException("statement is not evaluated: " + stmt.kind);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Value eval(Expr.ExprInterface expr) {
        if (depth >= maxDepth) throw new ExpressionDepthException("evaluator", maxDepth);
        depth++;
        try {
            return expr.accept(this);
        } finally {
            depth--;
        }
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return Value.ofLiteral(expr.value);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return resolveName(expr.name.lexeme);
    }

    private Value resolveName(String name) {
        Value v = env.lookup(name);
        if (v != null) return v;
        if (functions.containsKey(name)) return Value.func(name);
        throw new EvaluationException("name '" + name + "' is not defined");
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        return Arithmetic.binary(expr.operator.type, left, right);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        return Arithmetic.unary(expr.operator.type, eval(expr.right));
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR) {
            return Arithmetic.truthy(left) ? left : eval(expr.right);
        }
        return Arithmetic.truthy(left) ? eval(expr.right) : left;
    }

    @Override
    public Value visitCallExpr(Call expr) {
        String name = functionName(expr);
        if (!expr.keywords.isEmpty()) {
            throw new EvaluationException(name + "() keyword arguments are not supported");
        }
        VCalcLatex.BuiltinFunction fn = functions.get(name);
        if (fn == null) throw new EvaluationException("name '" + name + "' is not defined");

        List<Value> args = new ArrayList<>();
        for (Expr.ExprInterface arg : expr.arguments) {
            args.add(eval(arg));
        }
        Value result = fn.call(args);
        if (result == null) throw new EvaluationException(name + "() returned no value");
        return result;
    }

    /** The registry key a call resolves to: {@code f = sqrt; f(4)} calls {@code sqrt}. */
    private String functionName(Call expr) {
        Expr.ExprInterface callee = expr.callee;
        if (callee instanceof Attribute && isModuleReference(((Attribute) callee).receiver)) {
            return ((Attribute) callee).name.lexeme;
        }
        if (callee instanceof Variable && !env.exists(((Variable) callee).name.lexeme)) {
            return ((Variable) callee).name.lexeme;
        }
        Value target = eval(callee);
        if (target.type != Value.Type.FUNC) {
            throw new EvaluationException("'" + target.pyTypeName() + "' object is not callable");
        }
        return target.asFunc();
    }

    /** {@code math.sqrt}: a bare name that is not a variable reads as a module. */
    private boolean isModuleReference(Expr.ExprInterface receiver) {
        return receiver instanceof Variable && !env.exists(((Variable) receiver).name.lexeme);
    }

    @Override
    public Value visitCompareExpr(Compare expr) {
        Value left = eval(expr.left);
        for (int i = 0; i < expr.operators.size(); i++) {
            Value right = eval(expr.comparators.get(i));
            if (!Arithmetic.compare(expr.operators.get(i).type, left, right)) {
                return Value.bool(false);
            }
            left = right;
        }
        return Value.bool(true);
    }

    @Override
    public Value visitConditionalExpr(Conditional expr) {
        return Arithmetic.truthy(eval(expr.test)) ? eval(expr.thenBranch) : eval(expr.elseBranch);
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value target = eval(expr.target);
        Value key = eval(expr.index);
        return Arithmetic.index(target, key);
    }

    @Override
    public Value visitSequenceExpr(Sequence expr) {
        List<Value> items = new ArrayList<>();
        for (Expr.ExprInterface e : expr.elements) {
            items.add(eval(e));
        }
        return expr.tuple ? Value.tuple(items) : Value.list(items);
    }

    @Override
    public Value visitAttributeExpr(Attribute expr) {
        String attr = expr.name.lexeme;
        if (isModuleReference(expr.receiver)) {
            return resolveName(attr);
        }
        Value receiver = eval(expr.receiver);
        if (receiver.isNumber()) {
            if (attr.equals("real")) {
                if (receiver.type == Value.Type.COMPLEX) return Value.real(receiver.asComplex().re);
                return receiver.isIntegral() ? Value.integer(receiver.asInt()) : receiver;
            }
            if (attr.equals("imag")) {
                if (receiver.type == Value.Type.COMPLEX) return Value.real(receiver.asComplex().im);
                return receiver.isIntegral() ? Value.integer(0) : Value.real(0.0);
            }
        }
        throw new EvaluationException("'" + receiver.pyTypeName() + "' object has no attribute '" + attr + "'");
    }

    @Override
    public Value visitMapLiteralExpr(MapLiteral expr) {
        Map<Value, Value> entries = new LinkedHashMap<>();
        for (int i = 0; i < expr.keys.size(); i++) {
            Value key = eval(expr.keys.get(i));
            if (key.type == Value.Type.LIST || key.type == Value.Type.DICT) {
                throw new EvaluationException("unhashable type: '" + key.pyTypeName() + "'");
            }
            entries.put(key, eval(expr.values.get(i)));
        }
        return Value.dict(entries);
    }
}
