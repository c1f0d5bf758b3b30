package com.vcalc.latex.parser;

import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);

        /** 1-based source line of the statement's first token. */
        int line();
    }

    public interface StmtVisitor<R> {
        R visitAssignStmt(AssignStmt stmt);
        R visitAugAssignStmt(AugAssignStmt stmt);
        R visitOtherStmt(OtherStmt stmt);
    }

    /** {@code t1 = t2 = value}; targets are in source order. */
    public static final class AssignStmt implements Stmt {
        public final List<Expr.ExprInterface> targets;
        public final Expr.ExprInterface value;
        private final int line;

        public AssignStmt(List<Expr.ExprInterface> targets, Expr.ExprInterface value, int line) {
            this.targets = Collections.unmodifiableList(targets);
            this.value = value;
            this.line = line;
        }

        /** Target name when this is {@code name = value}, else null. */
        public String simpleTarget() {
            if (targets.size() != 1) return null;
            Expr.ExprInterface t = targets.get(0);
            return (t instanceof Expr.Variable) ? ((Expr.Variable) t).name.lexeme : null;
        }

        @Override public int line() { return line; }
        @Override public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    /** {@code target op= value}; operator is the augmented token ({@code +=}). */
    public static final class AugAssignStmt implements Stmt {
        public final Expr.ExprInterface target;
        public final Token operator;
        public final Expr.ExprInterface value;
        private final int line;

        public AugAssignStmt(Expr.ExprInterface target, Token operator, Expr.ExprInterface value, int line) {
            this.target = target;
            this.operator = operator;
            this.value = value;
            this.line = line;
        }

        public String simpleTarget() {
            return (target instanceof Expr.Variable) ? ((Expr.Variable) target).name.lexeme : null;
        }

        @Override public int line() { return line; }
        @Override public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAugAssignStmt(this); }
    }

    /** Anything the converter skips: imports, prints, definitions, control flow. */
    public static final class OtherStmt implements Stmt {
        public final String kind;
        private final int line;

        public OtherStmt(String kind, int line) {
            this.kind = kind;
            this.line = line;
        }

        @Override public int line() { return line; }
        @Override public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitOtherStmt(this); }
    }
}
