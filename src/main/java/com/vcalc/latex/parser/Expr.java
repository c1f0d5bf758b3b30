package com.vcalc.latex.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitCallExpr(Call expr);
        R visitCompareExpr(Compare expr);
        R visitConditionalExpr(Conditional expr);
        R visitIndexExpr(Index expr);
        R visitSequenceExpr(Sequence expr);

        // Parsed and evaluated, but not templated by the renderers
        R visitLogicalExpr(Logical expr);
        R visitAttributeExpr(Attribute expr);
        R visitMapLiteralExpr(MapLiteral expr);
    }

    /** Name a call resolves to: the variable name, or the attribute name for {@code math.sqrt}. */
    public static String calleeName(ExprInterface callee) {
        if (callee instanceof Variable) return ((Variable) callee).name.lexeme;
        if (callee instanceof Attribute) return ((Attribute) callee).name.lexeme;
        return "func";
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    /** BigInteger, Double, Complex, Boolean, String or null (None). */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;
        public final Map<String, ExprInterface> keywords;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this(callee, paren, arguments, new LinkedHashMap<>());
        }

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments,
                    LinkedHashMap<String, ExprInterface> keywords) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = Collections.unmodifiableList(arguments);
            this.keywords = Collections.unmodifiableMap(keywords);
        }

        public String name() {
            return calleeName(callee);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** {@code a < b <= c}: operators.size() == comparators.size(). */
    public static final class Compare implements ExprInterface {
        public final ExprInterface left;
        public final List<Token> operators;
        public final List<ExprInterface> comparators;

        public Compare(ExprInterface left, List<Token> operators, List<ExprInterface> comparators) {
            if (operators.size() != comparators.size()) {
                throw new IllegalArgumentException("operators and comparators differ in length");
            }
            this.left = left;
            this.operators = Collections.unmodifiableList(operators);
            this.comparators = Collections.unmodifiableList(comparators);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCompareExpr(this);
        }
    }

    /** {@code thenBranch if test else elseBranch}. */
    public static final class Conditional implements ExprInterface {
        public final ExprInterface test;
        public final ExprInterface thenBranch;
        public final ExprInterface elseBranch;

        public Conditional(ExprInterface test, ExprInterface thenBranch, ExprInterface elseBranch) {
            this.test = test;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditionalExpr(this);
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public Index(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    /** List or tuple display. */
    public static final class Sequence implements ExprInterface {
        public final List<ExprInterface> elements;
        public final boolean tuple;

        public Sequence(List<ExprInterface> elements, boolean tuple) {
            this.elements = Collections.unmodifiableList(elements);
            this.tuple = tuple;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSequenceExpr(this);
        }
    }

    // -------------------------
    // Untemplated nodes
    // -------------------------

    /** {@code and} / {@code or}. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Attribute implements ExprInterface {
        public final ExprInterface receiver;
        public final Token name;

        public Attribute(ExprInterface receiver, Token name) {
            this.receiver = receiver;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAttributeExpr(this);
        }
    }

    public static final class MapLiteral implements ExprInterface {
        public final List<ExprInterface> keys;
        public final List<ExprInterface> values;

        public MapLiteral(List<ExprInterface> keys, List<ExprInterface> values) {
            if (keys.size() != values.size()) throw new IllegalArgumentException("keys and values differ in length");
            this.keys = Collections.unmodifiableList(keys);
            this.values = Collections.unmodifiableList(values);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapLiteralExpr(this);
        }
    }
}
