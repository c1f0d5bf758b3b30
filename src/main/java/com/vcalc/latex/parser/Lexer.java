package com.vcalc.latex.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.vcalc.latex.CalcParseException;

/**
 * Tokenizer for Python calculation code.
 *
 * NEWLINE tokens are only produced outside brackets and never twice in a row;
 * a backslash at the end of a line joins it with the next one.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 0;
    private int bracketDepth = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("True", TokenType.TRUE);
        map.put("False", TokenType.FALSE);
        map.put("None", TokenType.NONE);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("in", TokenType.IN);
        map.put("is", TokenType.IS);
        map.put("lambda", TokenType.LAMBDA);
        for (String kw : new String[] {
                "import", "from", "def", "class", "for", "while", "elif", "try", "except",
                "finally", "with", "return", "pass", "break", "continue", "global", "nonlocal",
                "del", "assert", "raise", "yield", "async", "await", "as" }) {
            map.put(kw, TokenType.KEYWORD);
        }
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart;
            scanToken();
        }
        if (bracketDepth > 0) throw error("Unexpected end of input: unclosed bracket");
        start = current;
        startLine = line;
        startColumn = current - lineStart;
        addNewline();
        tokens.add(new Token(TokenType.EOF, "", null, line, startColumn));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': open(TokenType.LEFT_PAREN); break;
            case ')': close(TokenType.RIGHT_PAREN); break;
            case '[': open(TokenType.LEFT_BRACKET); break;
            case ']': close(TokenType.RIGHT_BRACKET); break;
            case '{': open(TokenType.LEFT_BRACE); break;
            case '}': close(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '~': addToken(TokenType.TILDE); break;
            case ':': addToken(match('=') ? TokenType.OTHER : TokenType.COLON); break;
            case '.':
                if (isDigit(peek())) {
                    number();
                } else if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.OTHER);
                } else {
                    addToken(TokenType.DOT);
                }
                break;
            case '@': addToken(match('=') ? TokenType.OTHER : TokenType.AT); break;
            case '+': addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS); break;
            case '-':
                if (match('=')) addToken(TokenType.MINUS_EQUAL);
                else if (match('>')) addToken(TokenType.OTHER);
                else addToken(TokenType.MINUS);
                break;
            case '*':
                if (match('*')) addToken(match('=') ? TokenType.DOUBLE_STAR_EQUAL : TokenType.DOUBLE_STAR);
                else addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR);
                break;
            case '/':
                if (match('/')) addToken(match('=') ? TokenType.DOUBLE_SLASH_EQUAL : TokenType.DOUBLE_SLASH);
                else addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                break;
            case '%': addToken(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT); break;
            case '&': addToken(match('=') ? TokenType.OTHER : TokenType.AMP); break;
            case '|': addToken(match('=') ? TokenType.OTHER : TokenType.PIPE); break;
            case '^': addToken(match('=') ? TokenType.OTHER : TokenType.CARET); break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error("Unexpected character: !");
                break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<':
                if (match('<')) addToken(match('=') ? TokenType.OTHER : TokenType.LSHIFT);
                else addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
                break;
            case '>':
                if (match('>')) addToken(match('=') ? TokenType.OTHER : TokenType.RSHIFT);
                else addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                break;
            case '#':
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case '\\':
                // explicit line joining
                match('\r');
                if (!match('\n')) throw error("Unexpected character after line continuation");
                newLine();
                break;
            case ' ': case '\r': case '\t': case '\f':
                break;
            case '\n':
                if (bracketDepth == 0) addNewline();
                newLine();
                break;
            case '"':
            case '\'':
                string(c, false);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        if ((peek() == '"' || peek() == '\'') && isStringPrefix(text)) {
            boolean raw = text.toLowerCase().indexOf('r') >= 0;
            string(advance(), raw);
            return;
        }
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private static boolean isStringPrefix(String text) {
        switch (text.toLowerCase()) {
            case "r": case "b": case "u": case "f":
            case "rb": case "br": case "fr": case "rf":
                return true;
            default:
                return false;
        }
    }

    private void number() {
        char first = source.charAt(start);
        if (first == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'o' || peek() == 'O'
                || peek() == 'b' || peek() == 'B')) {
            char kind = Character.toLowerCase(advance());
            int radix = (kind == 'x') ? 16 : (kind == 'o') ? 8 : 2;
            int digitsStart = current;
            while (Character.digit(peek(), radix) >= 0 || peek() == '_') advance();
            String digits = source.substring(digitsStart, current).replace("_", "");
            if (digits.isEmpty()) throw error("Invalid integer literal");
            addToken(TokenType.NUMBER, new BigInteger(digits, radix));
            return;
        }

        boolean real = (first == '.');
        digits();
        if (!real && peek() == '.') {
            real = true;
            advance();
            digits();
        }
        if (peek() == 'e' || peek() == 'E') {
            char sign = peekNext();
            int save = current;
            advance();
            if (sign == '+' || sign == '-') advance();
            if (isDigit(peek())) {
                real = true;
                digits();
            } else {
                current = save;
            }
        }

        String text = source.substring(start, current).replace("_", "");
        if (peek() == 'j' || peek() == 'J') {
            advance();
            addToken(TokenType.NUMBER, new Complex(0.0, Double.parseDouble(text)));
        } else if (real) {
            addToken(TokenType.NUMBER, Double.parseDouble(text));
        } else {
            addToken(TokenType.NUMBER, new BigInteger(text));
        }
    }

    private void digits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();
    }

    private void string(char quote, boolean raw) {
        boolean triple = false;
        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            triple = true;
        }

        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd()) throw error("Unterminated string");
            char c = advance();
            if (c == quote) {
                if (!triple) break;
                if (peek() == quote && peekNext() == quote) {
                    advance();
                    advance();
                    break;
                }
                sb.append(c);
                continue;
            }
            if (c == '\n') {
                if (!triple) throw error("Unterminated string");
                newLine();
                sb.append(c);
                continue;
            }
            if (c == '\\' && !isAtEnd()) {
                char e = advance();
                if (raw) {
                    sb.append('\\').append(e);
                    if (e == '\n') newLine();
                    continue;
                }
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    case '0': sb.append('\0'); break;
                    case '\\': sb.append('\\'); break;
                    case '\'': sb.append('\''); break;
                    case '"': sb.append('"'); break;
                    case '\n': newLine(); break;
                    case 'x': sb.append((char) hex(2)); break;
                    case 'u': sb.append((char) hex(4)); break;
                    default: sb.append('\\').append(e);
                }
                continue;
            }
            sb.append(c);
        }
        addToken(TokenType.STRING, sb.toString());
    }

    private int hex(int count) {
        if (current + count > source.length()) throw error("Truncated escape sequence");
        String digits = source.substring(current, current + count);
        current += count;
        try {
            return Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw error("Invalid escape sequence: \\" + digits);
        }
    }

    private void open(TokenType type) {
        bracketDepth++;
        addToken(type);
    }

    private void close(TokenType type) {
        if (bracketDepth == 0) throw error("Unmatched '" + source.charAt(start) + "'");
        bracketDepth--;
        addToken(type);
    }

    private void addNewline() {
        if (tokens.isEmpty()) return;
        if (tokens.get(tokens.size() - 1).type == TokenType.NEWLINE) return;
        tokens.add(new Token(TokenType.NEWLINE, "\n", null, startLine, startColumn));
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || (c > 127 && Character.isLetter(c));
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private CalcParseException error(String msg) {
        return new CalcParseException(msg, source, line, current - lineStart);
    }
}
