package com.kuzur.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.kuzur.debug.Debug;
import com.kuzur.script.errors.LexError;

public class Lexer {
    private static final String TAG = "Lexer";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    // position of the token being scanned
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("if", TokenType.IF);
        map.put("elif", TokenType.ELIF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("do", TokenType.DO);
        map.put("func", TokenType.FUNC);
        map.put("return", TokenType.RETURN);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, current - lineStart + 1));
        Debug.get().t(TAG, "produced " + tokens.size() + " tokens over " + line + " line(s)");
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else throw error("Unexpected '&' (did you mean '&&'?)");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else throw error("Unexpected '|' (did you mean '||'?)");
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                newLine();
                break;
            case '"':
            case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character '" + c + "'");
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.TRUE) addToken(type, Boolean.TRUE);
        else if (type == TokenType.FALSE) addToken(type, Boolean.FALSE);
        else addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    // Raw text between the quotes; a string may not span lines.
    private void string(char quote) {
        while (!isAtEnd() && peek() != quote && peek() != '\n') advance();
        if (isAtEnd() || peek() == '\n') {
            // reported where the line (or input) ran out
            throw new LexError(line, current - lineStart + 1,
                    "Unterminated string starting at line " + startLine + ", column " + startColumn);
        }
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
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
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private LexError error(String msg) {
        return new LexError(startLine, startColumn, msg);
    }
}
