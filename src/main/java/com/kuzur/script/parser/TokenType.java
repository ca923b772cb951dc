package com.kuzur.script.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    COMMA, SEMICOLON, PLUS, MINUS, STAR, SLASH, PERCENT,

    // One or two character tokens.
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals.
    IDENTIFIER, STRING, NUMBER,

    // Keywords.
    IF, ELIF, ELSE, WHILE, FOR, DO, FUNC, RETURN, BREAK, CONTINUE, TRUE, FALSE,

    EOF
}
