package com.kuzur.script.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    public final int line;
    public final int column;

    Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType type() { return type; }

    public Object literal() { return literal; }

    /** How the token reads in an error message. */
    String describe() {
        switch (type) {
            case EOF: return "end of input";
            case STRING: return "string " + lexeme;
            case NUMBER: return "number " + lexeme;
            case IDENTIFIER: return "identifier '" + lexeme + "'";
            default: return "'" + lexeme + "'";
        }
    }

    @Override
    public String toString() {
        return type + " " + lexeme + " @" + line + ":" + column;
    }
}
