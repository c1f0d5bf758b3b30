package com.vcalc.latex;

import java.util.ArrayList;
import java.util.List;

import com.vcalc.debug.Debug;
import com.vcalc.latex.parser.Environment;
import com.vcalc.latex.parser.Evaluator;
import com.vcalc.latex.parser.Expr;
import com.vcalc.latex.parser.Statement;
import com.vcalc.latex.parser.Statement.AssignStmt;
import com.vcalc.latex.parser.Statement.AugAssignStmt;
import com.vcalc.latex.parser.Statement.OtherStmt;
import com.vcalc.latex.parser.Value;

/**
 * Walks top-level statements in order and turns every {@code name = expr}
 * and {@code name op= expr} into an {@link AssignmentRecord}.
 *
 * A statement whose evaluation fails is dropped and leaves the environment
 * untouched; only {@link ExpressionDepthException} escapes. Everything that is not a single-name assignment is skipped
 * without being evaluated.
 */
public class StatementSequencer implements Statement.StmtVisitor<AssignmentRecord> {

    private static final String TAG = "vcalc.sequencer";

    private final Evaluator evaluator;
    private Environment env;

    public StatementSequencer(Evaluator evaluator) {
        if (evaluator == null) throw new IllegalArgumentException("evaluator is required");
        this.evaluator = evaluator;
    }

    /** Runs the program against {@code env}, which accumulates the bindings. */
    public List<AssignmentRecord> run(List<Statement.Stmt> program, Environment env) {
        this.env = env;
        List<AssignmentRecord> records = new ArrayList<>();
        try {
            for (Statement.Stmt stmt : program) {
                AssignmentRecord record = stmt.accept(this);
                if (record != null) records.add(record);
            }
        } finally {
            this.env = null;
        }
        return records;
    }

    @Override
    public AssignmentRecord visitAssignStmt(AssignStmt stmt) {
        String name = stmt.simpleTarget();
        if (name == null) {
            Debug.get().d(TAG, "line " + stmt.line() + ": skipped assignment to a non-name target");
            return null;
        }
        boolean trivial = stmt.value instanceof Expr.Literal;
        return apply(stmt, name, stmt.value, trivial);
    }

    @Override
    public AssignmentRecord visitAugAssignStmt(AugAssignStmt stmt) {
        String name = stmt.simpleTarget();
        if (name == null) {
            Debug.get().d(TAG, "line " + stmt.line() + ": skipped augmented assignment to a non-name target");
            return null;
        }
        return apply(stmt, name, null, true);
    }

    @Override
    public AssignmentRecord visitOtherStmt(OtherStmt stmt) {
        Debug.get().d(TAG, "line " + stmt.line() + ": skipped " + stmt.kind + " statement");
        return null;
    }

    private AssignmentRecord apply(Statement.Stmt stmt, String name, Expr.ExprInterface expression, boolean trivial) {
        Value value;
        try {
            value = evaluator.evaluate(stmt, env);
        } catch (ExpressionDepthException e) {
            throw e;
        } catch (RuntimeException e) {
            // host functions and custom evaluators may throw anything
            Debug.get().d(TAG, "line " + stmt.line() + ": dropped '" + name + "': " + e.getMessage());
            return null;
        }
        env.define(name, value);
        Debug.get().d(TAG, "line " + stmt.line() + ": " + name + " = " + value.repr());
        return new AssignmentRecord(name, expression, value, trivial, env.snapshot(), stmt.line());
    }
}
