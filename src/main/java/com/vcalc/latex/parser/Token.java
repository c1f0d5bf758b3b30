package com.vcalc.latex.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;
    /** 0-based; for the first token of a line this is its indentation. */
    public final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    /** Token for trees built by hand rather than by the parser. */
    public static Token of(TokenType type, String lexeme) {
        return new Token(type, lexeme, null, 0, 0);
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + line + ":" + column;
    }
}
