package com.posh.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private boolean spaced = true;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    private static final Map<String, TokenType> keywords;
    private static final Map<String, TokenType> dashOperators;
    static {
        Map<String, TokenType> kw = new HashMap<>();
        kw.put("if", TokenType.IF);
        kw.put("elseif", TokenType.ELSEIF);
        kw.put("else", TokenType.ELSE);
        kw.put("function", TokenType.FUNCTION);
        kw.put("return", TokenType.RETURN);
        keywords = Collections.unmodifiableMap(kw);

        Map<String, TokenType> ops = new HashMap<>();
        ops.put("eq", TokenType.EQ);
        ops.put("ne", TokenType.NE);
        ops.put("gt", TokenType.GT);
        ops.put("lt", TokenType.LT);
        ops.put("ge", TokenType.GE);
        ops.put("le", TokenType.LE);
        ops.put("and", TokenType.AND);
        ops.put("or", TokenType.OR);
        ops.put("not", TokenType.NOT);
        dashOperators = Collections.unmodifiableMap(ops);
    }

    /** Embedded expression inside a double-quoted string: {@code $name} or {@code $( ... )}. */
    public static final class Hole {
        public final String source;
        public final int line;

        Hole(String source, int line) {
            this.source = source;
            this.line = line;
        }
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            markStart();
            scanToken();
        }
        markStart();
        addToken(TokenType.EOF, null);
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '|': addToken(TokenType.PIPE); break;
            case '&': addToken(TokenType.AMPERSAND); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '!': addToken(TokenType.BANG); break;
            case '=': addToken(TokenType.EQUAL); break;
            case '+': addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS); break;
            case '-': dash(); break;
            case '@':
                if (match('(')) addToken(TokenType.AT_PAREN);
                else if (match('{')) addToken(TokenType.AT_BRACE);
                else throw error("Expected '(' or '{' after '@'");
                break;
            case '$': variable(); break;
            case '#':
                while (!isAtEnd() && peek() != '\n') advance();
                spaced = true;
                break;
            case '<':
                if (match('#')) blockComment();
                else throw error("Unexpected character: <");
                break;
            case '`':
                // line continuation
                if (match('\r')) match('\n');
                else if (!match('\n')) throw error("Unexpected '`'");
                newLine();
                spaced = true;
                break;
            case ' ': case '\r': case '\t':
                spaced = true;
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                newLine();
                spaced = true;
                break;
            case '\'': singleQuoted(); break;
            case '"': doubleQuoted(); break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void markStart() {
        start = current;
        tokenLine = line;
        tokenColumn = current - lineStart + 1;
    }

    private void dash() {
        if (match('=')) {
            addToken(TokenType.MINUS_EQUAL);
            return;
        }
        if (!isAlpha(peek())) {
            addToken(TokenType.MINUS);
            return;
        }
        while (isAlphaNumeric(peek())) advance();
        String word = source.substring(start + 1, current);
        TokenType op = dashOperators.get(word.toLowerCase(Locale.ROOT));
        if (op != null) addToken(op);
        else addToken(TokenType.PARAMETER, word);
    }

    private void variable() {
        if (peek() == '(') {
            // $( ... ) outside a string is plain grouping
            advance();
            addToken(TokenType.LEFT_PAREN);
            return;
        }
        String name = scanVariableName();
        if (name.isEmpty()) throw error("Expected variable name after '$'");
        switch (name.toLowerCase(Locale.ROOT)) {
            case "true": addToken(TokenType.TRUE, Boolean.TRUE); return;
            case "false": addToken(TokenType.FALSE, Boolean.FALSE); return;
            case "null": addToken(TokenType.NULL); return;
            default: addToken(TokenType.VARIABLE, name);
        }
    }

    // Reads name or scope:name after '$'; current is just past '$'.
    private String scanVariableName() {
        int nameStart = current;
        while (isAlphaNumeric(peek())) advance();
        if (current > nameStart && peek() == ':' && isAlpha(peekNext())) {
            advance();
            while (isAlphaNumeric(peek())) advance();
        }
        return source.substring(nameStart, current);
    }

    private void blockComment() {
        while (!isAtEnd() && !(peek() == '#' && peekNext() == '>')) {
            if (advance() == '\n') newLine();
        }
        if (isAtEnd()) throw error("Unterminated block comment");
        current += 2;
        spaced = true;
    }

    private void identifier() {
        while (isAlphaNumeric(peek()) || (peek() == '-' && isAlpha(peekNext()))) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text.toLowerCase(Locale.ROOT), TokenType.IDENTIFIER);
        addToken(type, text);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '-' || peekNext() == '+') && isDigit(peekAt(2))))) {
            advance();
            if (peek() == '-' || peek() == '+') advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void singleQuoted() {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd()) throw error("Unterminated string");
            char c = advance();
            if (c == '\'') {
                if (match('\'')) {
                    sb.append('\'');
                    continue;
                }
                break;
            }
            if (c == '\n') newLine();
            sb.append(c);
        }
        addToken(TokenType.STRING, sb.toString());
    }

    private void doubleQuoted() {
        List<Object> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        boolean hasHole = false;

        while (true) {
            if (isAtEnd()) throw error("Unterminated string");
            char c = advance();
            if (c == '"') {
                if (match('"')) {
                    text.append('"');
                    continue;
                }
                break;
            }
            if (c == '\\' || c == '`') {
                if (isAtEnd()) throw error("Unterminated string");
                text.append(escape(advance()));
                continue;
            }
            if (c == '$' && peek() == '(') {
                advance();
                flush(parts, text);
                parts.add(new Hole(subexpression(), line));
                hasHole = true;
                continue;
            }
            if (c == '$' && (isAlpha(peek()) || isDigit(peek()))) {
                flush(parts, text);
                int holeLine = line;
                parts.add(new Hole("$" + scanVariableName(), holeLine));
                hasHole = true;
                continue;
            }
            if (c == '\n') newLine();
            text.append(c);
        }
        flush(parts, text);

        if (!hasHole) {
            addToken(TokenType.STRING, parts.isEmpty() ? "" : (String) parts.get(0));
            return;
        }
        tokens.add(new Token(TokenType.INTERPOLATED_STRING, source.substring(start, current),
                Collections.unmodifiableList(parts), tokenLine, tokenColumn, start, spaced));
        spaced = false;
    }

    // Body of $( ... ) up to the matching ')'; current is just past '('.
    private String subexpression() {
        int bodyStart = current;
        int depth = 1;
        while (!isAtEnd()) {
            char c = advance();
            if (c == '\n') newLine();
            else if (c == '(') depth++;
            else if (c == ')' && --depth == 0) return source.substring(bodyStart, current - 1);
            else if (c == '\'') {
                while (!isAtEnd() && peek() != '\'') advance();
                if (!isAtEnd()) advance();
            }
        }
        throw error("Unterminated $( in string");
    }

    private static void flush(List<Object> parts, StringBuilder text) {
        if (text.length() > 0) {
            parts.add(text.toString());
            text.setLength(0);
        }
    }

    private char escape(char c) {
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            default: return c;
        }
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
    private char peekNext() { return peekAt(1); }
    private char peekAt(int n) { return (current + n >= source.length()) ? '\0' : source.charAt(current + n); }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private static boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, tokenLine, tokenColumn, start, spaced));
        spaced = false;
    }

    private ParseException error(String msg) {
        return new ParseException(tokenLine, tokenColumn, msg);
    }
}
