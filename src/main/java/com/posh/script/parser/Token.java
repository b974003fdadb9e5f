package com.posh.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;
    public final int column;
    /** Offset of the token's first character in the source, -1 when synthesized. */
    final int offset;
    /** Whitespace (or start of input) precedes this token. */
    final boolean spaced;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this(type, lexeme, literal, line, column, -1, true);
    }

    Token(TokenType type, String lexeme, Object literal, int line, int column, int offset, boolean spaced) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.spaced = spaced;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "'";
    }
}
