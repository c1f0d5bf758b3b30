package com.vcalc.latex;

/**
 * The source text could not be turned into statements. Raised before any
 * statement is evaluated, so a conversion either parses completely or not at all.
 */
public class CalcParseException extends VCalcException {

    private final String source;
    private final int line;
    private final int column;

    public CalcParseException(String message, String source, int line, int column) {
        super("[line " + line + ", col " + column + "] " + message);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
