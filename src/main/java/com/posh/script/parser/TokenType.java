package com.posh.script.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, PIPE, AMPERSAND, SEMICOLON, NEWLINE,
    PLUS, MINUS, STAR, SLASH, PERCENT, BANG, EQUAL,
    PLUS_EQUAL, MINUS_EQUAL,

    // @( and @{
    AT_PAREN, AT_BRACE,

    // Dash operators (-eq, -and, ...)
    EQ, NE, GT, LT, GE, LE, AND, OR, NOT,

    // Literals
    NUMBER, STRING, INTERPOLATED_STRING, VARIABLE, IDENTIFIER, PARAMETER,

    // Keywords
    IF, ELSEIF, ELSE, FUNCTION, RETURN, TRUE, FALSE, NULL,

    EOF
}
