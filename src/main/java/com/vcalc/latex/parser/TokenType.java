package com.vcalc.latex.parser;

public enum TokenType {
    // Brackets and punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON, DOT, SEMICOLON, AT,

    // Arithmetic
    PLUS, MINUS, STAR, DOUBLE_STAR, SLASH, DOUBLE_SLASH, PERCENT, TILDE,
    AMP, PIPE, CARET, LSHIFT, RSHIFT,

    // Assignment
    EQUAL,
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, DOUBLE_STAR_EQUAL,
    SLASH_EQUAL, DOUBLE_SLASH_EQUAL, PERCENT_EQUAL,

    // Comparison (NOT_IN / IS_NOT are folded from two keywords by the parser)
    EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    IN, NOT_IN, IS, IS_NOT,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Expression keywords
    TRUE, FALSE, NONE, AND, OR, NOT, IF, ELSE, LAMBDA,

    // Statement keywords the converter never evaluates (lexeme tells which)
    KEYWORD,

    // Operators that are valid Python but unsupported in calculations (->, :=, ..., &=, ...)
    OTHER,

    NEWLINE, EOF;

    public boolean isAugmentedAssign() {
        switch (this) {
            case PLUS_EQUAL:
            case MINUS_EQUAL:
            case STAR_EQUAL:
            case DOUBLE_STAR_EQUAL:
            case SLASH_EQUAL:
            case DOUBLE_SLASH_EQUAL:
            case PERCENT_EQUAL:
                return true;
            default:
                return false;
        }
    }

    /** The binary operator applied by an augmented assignment ({@code +=} -> {@code +}). */
    public TokenType binaryOf() {
        switch (this) {
            case PLUS_EQUAL: return PLUS;
            case MINUS_EQUAL: return MINUS;
            case STAR_EQUAL: return STAR;
            case DOUBLE_STAR_EQUAL: return DOUBLE_STAR;
            case SLASH_EQUAL: return SLASH;
            case DOUBLE_SLASH_EQUAL: return DOUBLE_SLASH;
            case PERCENT_EQUAL: return PERCENT;
            default:
                throw new IllegalStateException("Not an augmented assignment: " + this);
        }
    }
}
