package com.posh.script.parser;

/** Lexing or parsing failure, positioned at the offending source line and column. */
public class ParseException extends RuntimeException {
    private final int line;
    private final int column;

    public ParseException(int line, int column, String message) {
        super("[line " + line + ", col " + column + "] " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() { return line; }

    public int getColumn() { return column; }
}
