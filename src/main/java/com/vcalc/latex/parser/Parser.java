package com.vcalc.latex.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import com.vcalc.latex.CalcParseException;
import com.vcalc.latex.ExpressionDepthException;
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
import com.vcalc.latex.parser.Statement.Stmt;

/**
 * Parses the top level of a Python calculation block.
 *
 * Only assignments are parsed into expression trees. Everything else
 * (imports, calls made for effect, def/class/if/for blocks with their bodies)
 * is classified into an {@link OtherStmt} so surrounding code never stops a
 * conversion. Valid Python the converter cannot model (lambda, slices,
 * comprehensions, walrus, star-unpacking, sets) is classified the same way.
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 200;

    private static final Set<String> COMPOUND = new HashSet<>(Arrays.asList(
            "def", "class", "for", "while", "elif", "try", "except", "finally", "with", "async"));

    private final List<Token> tokens;
    private final String source;
    private int current = 0;
    private int segmentEnd = 0;
    private int depth = 0;
    private int maxDepth = DEFAULT_MAX_DEPTH;

    public Parser(List<Token> tokens) {
        this(tokens, null);
    }

    public Parser(List<Token> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    /** Lex and parse in one step. */
    public static List<Stmt> parse(String source, int maxDepth) {
        Parser parser = new Parser(new Lexer(source).tokenize(), source);
        parser.setMaxDepth(maxDepth);
        return parser.parse();
    }

    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) continue;
            logicalLine(statements);
        }
        return statements;
    }

    // -------------------------
    // Statements
    // -------------------------

    private void logicalLine(List<Stmt> out) {
        Token first = peek();
        if (first.column > 0) throw error(first, "unexpected indent");

        if (isCompoundHeader()) {
            out.add(new OtherStmt(compoundKind(first), first.line));
            skipPast(TokenType.NEWLINE);
            // swallow the indented body
            while (!isAtEnd() && peek().column > first.column) {
                skipPast(TokenType.NEWLINE);
            }
            return;
        }

        while (true) {
            out.add(simpleStatement());
            if (match(TokenType.SEMICOLON)) {
                if (check(TokenType.NEWLINE) || isAtEnd()) break;
                continue;
            }
            break;
        }
        if (!isAtEnd()) consume(TokenType.NEWLINE, "invalid syntax");
    }

    private boolean isCompoundHeader() {
        Token t = peek();
        if (t.type == TokenType.IF || t.type == TokenType.ELSE) return true;
        if (t.type == TokenType.KEYWORD && COMPOUND.contains(t.lexeme)) return true;
        // `match` is a soft keyword: `match x:` opens a block, `match = 3` does not
        if (t.type == TokenType.IDENTIFIER && t.lexeme.equals("match")) {
            int i = current + 1;
            int bracket = 0;
            Token last = null;
            for (; i < tokens.size(); i++) {
                Token k = tokens.get(i);
                if (k.type == TokenType.NEWLINE || k.type == TokenType.EOF) break;
                if (isOpen(k.type)) bracket++;
                if (isClose(k.type)) bracket--;
                if (bracket == 0 && (k.type == TokenType.EQUAL || k.type.isAugmentedAssign())) return false;
                last = k;
            }
            return last != null && last.type == TokenType.COLON && i > current + 2;
        }
        return false;
    }

    private static String compoundKind(Token t) {
        return t.lexeme;
    }

    private Stmt simpleStatement() {
        Token first = peek();
        segmentEnd = findSegmentEnd(current);

        if (first.type == TokenType.KEYWORD) return skipSegment(first.lexeme, first);
        if (first.type == TokenType.AT) return skipSegment("decorator", first);

        int equalAt = -1;
        int augAt = -1;
        int colonAt = -1;
        int bracket = 0;
        for (int i = current; i < segmentEnd; i++) {
            Token t = tokens.get(i);
            String unsupported = unsupportedKind(i, bracket);
            if (unsupported != null) return skipSegment(unsupported, first);
            if (isOpen(t.type)) bracket++;
            else if (isClose(t.type)) bracket--;
            else if (bracket == 0) {
                if (t.type == TokenType.EQUAL && equalAt < 0) equalAt = i;
                else if (t.type.isAugmentedAssign() && augAt < 0) augAt = i;
                else if (t.type == TokenType.COLON && colonAt < 0) colonAt = i;
            }
        }

        int assignAt = (equalAt < 0) ? augAt : (augAt < 0 ? equalAt : Math.min(equalAt, augAt));
        if (assignAt < 0) return skipSegment("expression", first);
        if (colonAt >= 0 && colonAt < assignAt) return skipSegment("annotated", first);

        if (assignAt == augAt) {
            Expr.ExprInterface target = testList();
            Token op = advance();
            if (!op.type.isAugmentedAssign()) throw error(op, "invalid syntax");
            Expr.ExprInterface value = testList();
            endOfSegment();
            return new AugAssignStmt(target, op, value, first.line);
        }

        List<Expr.ExprInterface> parts = new ArrayList<>();
        parts.add(testList());
        while (match(TokenType.EQUAL)) {
            parts.add(testList());
        }
        if (current < segmentEnd && tokens.get(current).type.isAugmentedAssign()) {
            throw error(peek(), "invalid syntax");
        }
        endOfSegment();
        Expr.ExprInterface value = parts.remove(parts.size() - 1);
        return new AssignStmt(parts, value, first.line);
    }

    /** Valid Python that is out of reach of the calculator, or null. */
    private String unsupportedKind(int i, int bracket) {
        Token t = tokens.get(i);
        switch (t.type) {
            case LAMBDA:
                return "lambda";
            case KEYWORD:
                return t.lexeme.equals("for") ? "comprehension" : t.lexeme;
            case OTHER:
            case AT:
                return "unsupported";
            case COLON:
                if (bracket > 0 && innermostOpen(i) == TokenType.LEFT_BRACKET) return "slice";
                return null;
            case STAR:
            case DOUBLE_STAR: {
                if (i == current) return "unpacking";
                TokenType prev = tokens.get(i - 1).type;
                if (prev == TokenType.COMMA || prev == TokenType.LEFT_PAREN || prev == TokenType.LEFT_BRACKET
                        || prev == TokenType.EQUAL || prev == TokenType.LEFT_BRACE) {
                    return "unpacking";
                }
                return null;
            }
            case LEFT_BRACE:
                return isSetDisplay(i) ? "set" : null;
            default:
                return null;
        }
    }

    private TokenType innermostOpen(int index) {
        int level = 0;
        for (int i = index - 1; i >= current; i--) {
            TokenType type = tokens.get(i).type;
            if (isClose(type)) level++;
            else if (isOpen(type)) {
                if (level == 0) return type;
                level--;
            }
        }
        return null;
    }

    /** {@code {1, 2}} as opposed to {@code {}} or {@code {k: v}}. */
    private boolean isSetDisplay(int openAt) {
        int level = 0;
        for (int i = openAt + 1; i < segmentEnd; i++) {
            TokenType type = tokens.get(i).type;
            if (level == 0 && type == TokenType.RIGHT_BRACE) return i != openAt + 1;
            if (level == 0 && type == TokenType.COLON) return false;
            if (isOpen(type)) level++;
            else if (isClose(type)) level--;
        }
        return false;
    }

    private int findSegmentEnd(int from) {
        int bracket = 0;
        for (int i = from; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type;
            if (isOpen(type)) bracket++;
            else if (isClose(type)) bracket--;
            if (type == TokenType.EOF || type == TokenType.NEWLINE) return i;
            if (bracket == 0 && type == TokenType.SEMICOLON) return i;
        }
        return tokens.size() - 1;
    }

    private Stmt skipSegment(String kind, Token first) {
        current = segmentEnd;
        return new OtherStmt(kind, first.line);
    }

    private void endOfSegment() {
        if (current != segmentEnd) throw error(peek(), "invalid syntax");
    }

    private void skipPast(TokenType type) {
        while (!isAtEnd() && !check(type)) advance();
        match(type);
    }

    // -------------------------
    // Expressions (Python precedence, lowest first)
    // -------------------------

    /** {@code a, b, c} forms a tuple; a single element without a comma does not. */
    private Expr.ExprInterface testList() {
        Expr.ExprInterface first = test();
        if (!check(TokenType.COMMA)) return first;
        List<Expr.ExprInterface> items = new ArrayList<>();
        items.add(first);
        while (match(TokenType.COMMA)) {
            if (atTestListEnd()) break;
            items.add(test());
        }
        return new Sequence(items, true);
    }

    private boolean atTestListEnd() {
        if (current >= segmentEnd) return true;
        TokenType type = peek().type;
        return type == TokenType.EQUAL || type.isAugmentedAssign() || type == TokenType.RIGHT_PAREN
                || type == TokenType.RIGHT_BRACKET || type == TokenType.NEWLINE || type == TokenType.EOF;
    }

    private Expr.ExprInterface test() {
        enter();
        try {
            Expr.ExprInterface expr = orTest();
            if (match(TokenType.IF)) {
                Expr.ExprInterface condition = orTest();
                consume(TokenType.ELSE, "expected 'else' after conditional expression");
                Expr.ExprInterface otherwise = test();
                return new Conditional(condition, expr, otherwise);
            }
            return expr;
        } finally {
            exit();
        }
    }

    private Expr.ExprInterface orTest() {
        Expr.ExprInterface expr = andTest();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr.ExprInterface right = andTest();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface andTest() {
        Expr.ExprInterface expr = notTest();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = notTest();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface notTest() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            enter();
            try {
                return new Unary(op, notTest());
            } finally {
                exit();
            }
        }
        return comparison();
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface left = bitOr();
        List<Token> operators = new ArrayList<>();
        List<Expr.ExprInterface> comparators = new ArrayList<>();
        while (true) {
            Token op = compareOperator();
            if (op == null) break;
            operators.add(op);
            comparators.add(bitOr());
        }
        if (operators.isEmpty()) return left;
        return new Compare(left, operators, comparators);
    }

    private Token compareOperator() {
        if (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.IN)) {
            return previous();
        }
        if (check(TokenType.NOT) && peekNext().type == TokenType.IN) {
            Token not = advance();
            advance();
            return new Token(TokenType.NOT_IN, "not in", null, not.line, not.column);
        }
        if (match(TokenType.IS)) {
            Token is = previous();
            if (match(TokenType.NOT)) return new Token(TokenType.IS_NOT, "is not", null, is.line, is.column);
            return is;
        }
        return null;
    }

    private Expr.ExprInterface bitOr() {
        Expr.ExprInterface expr = bitXor();
        while (match(TokenType.PIPE)) {
            Token op = previous();
            expr = new Binary(expr, op, bitXor());
        }
        return expr;
    }

    private Expr.ExprInterface bitXor() {
        Expr.ExprInterface expr = bitAnd();
        while (match(TokenType.CARET)) {
            Token op = previous();
            expr = new Binary(expr, op, bitAnd());
        }
        return expr;
    }

    private Expr.ExprInterface bitAnd() {
        Expr.ExprInterface expr = shift();
        while (match(TokenType.AMP)) {
            Token op = previous();
            expr = new Binary(expr, op, shift());
        }
        return expr;
    }

    private Expr.ExprInterface shift() {
        Expr.ExprInterface expr = arith();
        while (match(TokenType.LSHIFT, TokenType.RSHIFT)) {
            Token op = previous();
            expr = new Binary(expr, op, arith());
        }
        return expr;
    }

    private Expr.ExprInterface arith() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            expr = new Binary(expr, op, term());
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.DOUBLE_SLASH, TokenType.PERCENT)) {
            Token op = previous();
            expr = new Binary(expr, op, factor());
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        if (match(TokenType.MINUS, TokenType.PLUS, TokenType.TILDE)) {
            Token op = previous();
            enter();
            try {
                return new Unary(op, factor());
            } finally {
                exit();
            }
        }
        return power();
    }

    /** {@code -2**2} is {@code -(2**2)}; {@code 2**-1} is {@code 2**(-1)}. */
    private Expr.ExprInterface power() {
        Expr.ExprInterface base = postfix();
        if (match(TokenType.DOUBLE_STAR)) {
            Token op = previous();
            enter();
            try {
                return new Binary(base, op, factor());
            } finally {
                exit();
            }
        }
        return base;
    }

    private Expr.ExprInterface postfix() {
        Expr.ExprInterface expr = atom();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                Expr.ExprInterface index = testList();
                consume(TokenType.RIGHT_BRACKET, "expected ']' after index");
                expr = new Index(expr, index, bracket);
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "expected attribute name after '.'");
                expr = new Attribute(expr, name);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        LinkedHashMap<String, Expr.ExprInterface> keywords = new LinkedHashMap<>();

        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (check(TokenType.RIGHT_PAREN)) break;
                if (check(TokenType.IDENTIFIER) && peekNext().type == TokenType.EQUAL) {
                    Token name = advance();
                    advance();
                    if (keywords.containsKey(name.lexeme)) throw error(name, "keyword argument repeated: " + name.lexeme);
                    keywords.put(name.lexeme, test());
                } else {
                    if (!keywords.isEmpty()) throw error(peek(), "positional argument follows keyword argument");
                    arguments.add(test());
                }
            } while (match(TokenType.COMMA));
        }

        Token paren = consume(TokenType.RIGHT_PAREN, "expected ')' after arguments");
        return new Call(callee, paren, arguments, keywords);
    }

    private Expr.ExprInterface atom() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NONE)) return new Literal(null);
        if (match(TokenType.NUMBER)) return new Literal(previous().literal);
        if (match(TokenType.STRING)) {
            // adjacent literals concatenate
            StringBuilder sb = new StringBuilder((String) previous().literal);
            while (match(TokenType.STRING)) sb.append((String) previous().literal);
            return new Literal(sb.toString());
        }
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            if (match(TokenType.RIGHT_PAREN)) return new Sequence(new ArrayList<>(), true);
            Expr.ExprInterface expr = testList();
            consume(TokenType.RIGHT_PAREN, "expected ')' after expression");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            List<Expr.ExprInterface> items = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACKET)) {
                items.add(test());
                if (!match(TokenType.COMMA)) break;
            }
            consume(TokenType.RIGHT_BRACKET, "expected ']' after list");
            return new Sequence(items, false);
        }

        if (match(TokenType.LEFT_BRACE)) {
            List<Expr.ExprInterface> keys = new ArrayList<>();
            List<Expr.ExprInterface> values = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACE)) {
                keys.add(test());
                consume(TokenType.COLON, "expected ':' after dict key");
                values.add(test());
                if (!match(TokenType.COMMA)) break;
            }
            consume(TokenType.RIGHT_BRACE, "expected '}' after dict");
            return new MapLiteral(keys, values);
        }

        throw error(peek(), "invalid syntax");
    }

    // -------------------------
    // Helpers
    // -------------------------

    private void enter() {
        if (++depth > maxDepth) throw new ExpressionDepthException("parser", maxDepth);
    }

    private void exit() {
        depth--;
    }

    private static boolean isOpen(TokenType type) {
        return type == TokenType.LEFT_PAREN || type == TokenType.LEFT_BRACKET || type == TokenType.LEFT_BRACE;
    }

    private static boolean isClose(TokenType type) {
        return type == TokenType.RIGHT_PAREN || type == TokenType.RIGHT_BRACKET || type == TokenType.RIGHT_BRACE;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token peekNext() { return tokens.get(Math.min(current + 1, tokens.size() - 1)); }
    private Token previous() { return tokens.get(current - 1); }

    private CalcParseException error(Token token, String message) {
        String near = (token.type == TokenType.EOF || token.type == TokenType.NEWLINE)
                ? " at end of line" : " near '" + token.lexeme + "'";
        return new CalcParseException(message + near, source, token.line, token.column);
    }
}
