package com.vcalc.latex;

import com.vcalc.latex.parser.Environment;
import com.vcalc.latex.parser.Expr;
import com.vcalc.latex.parser.Value;

/**
 * One accepted assignment, in source order.
 *
 * {@code expression} is null for augmented assignments; {@code scope} is the
 * environment right after the statement bound its target.
 */
public final class AssignmentRecord {
    private final String target;
    private final Expr.ExprInterface expression;
    private final Value value;
    private final boolean trivial;
    private final Environment scope;
    private final int line;

    public AssignmentRecord(String target, Expr.ExprInterface expression, Value value,
                            boolean trivial, Environment scope, int line) {
        if (target == null) throw new IllegalArgumentException("target is required");
        if (value == null) throw new IllegalArgumentException("value is required");
        if (!trivial && expression == null) throw new IllegalArgumentException("derived record needs an expression");
        this.target = target;
        this.expression = expression;
        this.value = value;
        this.trivial = trivial;
        this.scope = (scope == null) ? new Environment() : scope;
        this.line = line;
    }

    public String target() { return target; }
    public Expr.ExprInterface expression() { return expression; }
    public Value value() { return value; }
    public boolean trivial() { return trivial; }
    public Environment scope() { return scope; }
    public int line() { return line; }

    @Override
    public String toString() {
        return "AssignmentRecord{" + target + " = " + value.repr() + (trivial ? ", trivial" : "") + ", line " + line + "}";
    }
}
