package com.otto.script.parser;

import com.otto.script.error.LexException;
import com.otto.script.model.ColorTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns script text into tokens. Tokens can be pulled one at a time with {@link #nextToken()}
 * and looked at ahead of time with {@link #peekToken()}, or collected in one go with {@link #tokenize()}.
 * Keywords are matched case-insensitively; identifiers keep their spelling.
 */
public class Lexer {
    private final String source;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    private int start = 0;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("param", TokenType.PARAM);
        map.put("shape", TokenType.SHAPE);
        map.put("layer", TokenType.LAYER);
        map.put("transform", TokenType.TRANSFORM);
        map.put("add", TokenType.ADD);
        map.put("subtract", TokenType.SUBTRACT);
        map.put("rotate", TokenType.ROTATE);
        map.put("scale", TokenType.SCALE);
        map.put("position", TokenType.POSITION);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("endif", TokenType.ENDIF);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("for", TokenType.FOR);
        map.put("from", TokenType.FROM);
        map.put("to", TokenType.TO);
        map.put("step", TokenType.STEP);
        map.put("in", TokenType.IN);
        map.put("def", TokenType.DEF);
        map.put("return", TokenType.RETURN);
        map.put("union", TokenType.UNION);
        map.put("difference", TokenType.DIFFERENCE);
        map.put("intersection", TokenType.INTERSECTION);
        map.put("draw", TokenType.DRAW);
        map.put("forward", TokenType.FORWARD);
        map.put("backward", TokenType.BACKWARD);
        map.put("right", TokenType.RIGHT);
        map.put("left", TokenType.LEFT);
        map.put("goto", TokenType.GOTO);
        map.put("penup", TokenType.PENUP);
        map.put("pendown", TokenType.PENDOWN);
        map.put("constraints", TokenType.CONSTRAINTS);
        map.put("coincident", TokenType.COINCIDENT);
        map.put("distance", TokenType.DISTANCE);
        map.put("horizontal", TokenType.HORIZONTAL);
        map.put("vertical", TokenType.VERTICAL);

        // Styling, with the aliases people actually type
        map.put("fill", TokenType.FILL);
        map.put("filled", TokenType.FILLED);
        map.put("fillcolor", TokenType.FILLCOLOR);
        map.put("background", TokenType.FILLCOLOR);
        map.put("color", TokenType.COLOR);
        map.put("stroke", TokenType.STROKE);
        map.put("strokecolor", TokenType.STROKECOLOR);
        map.put("border", TokenType.STROKECOLOR);
        map.put("strokewidth", TokenType.STROKEWIDTH);
        map.put("thickness", TokenType.STROKEWIDTH);
        map.put("opacity", TokenType.OPACITY);
        map.put("alpha", TokenType.OPACITY);
        map.put("transparent", TokenType.TRANSPARENT);
        map.put("visible", TokenType.VISIBLE);
        map.put("hidden", TokenType.HIDDEN);
        map.put("style", TokenType.STYLE);
        keywords = Collections.unmodifiableMap(map);
    }

    private static final Pattern RGB_PATTERN =
            Pattern.compile("^rgba?\\(\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+\\s*(,\\s*[\\d.]+\\s*)?\\)$");
    private static final Pattern HSL_PATTERN =
            Pattern.compile("^hsla?\\(\\s*\\d+\\s*,\\s*\\d+%\\s*,\\s*\\d+%\\s*(,\\s*[\\d.]+\\s*)?\\)$");
    private static final Pattern HEX_PATTERN =
            Pattern.compile("^#([0-9a-fA-F]{3}|[0-9a-fA-F]{4}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})$");

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = nextToken();
            tokens.add(token);
            if (token.type == TokenType.EOF) return tokens;
        }
    }

    /** Consumes and returns the next token; returns EOF forever once the input is exhausted. */
    public Token nextToken() {
        while (true) {
            skipWhitespaceAndComments();
            start = current;
            startLine = line;
            startColumn = column;
            if (isAtEnd()) return new Token(TokenType.EOF, "", null, line, column);

            Token token = scanToken();
            if (token != null) return token;
        }
    }

    /** Returns the next token without consuming it. */
    public Token peekToken() {
        int savedCurrent = current;
        int savedLine = line;
        int savedColumn = column;
        int savedStart = start;
        int savedStartLine = startLine;
        int savedStartColumn = startColumn;
        try {
            return nextToken();
        } finally {
            current = savedCurrent;
            line = savedLine;
            column = savedColumn;
            start = savedStart;
            startLine = savedStartLine;
            startColumn = savedStartColumn;
        }
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '(': return token(TokenType.LEFT_PAREN);
            case ')': return token(TokenType.RIGHT_PAREN);
            case '{': return token(TokenType.LEFT_BRACE);
            case '}': return token(TokenType.RIGHT_BRACE);
            case '[': return token(TokenType.LEFT_BRACKET);
            case ']': return token(TokenType.RIGHT_BRACKET);
            case ',': return token(TokenType.COMMA);
            case ':': return token(TokenType.COLON);
            case ';': return token(TokenType.SEMICOLON);
            case '.': return token(TokenType.DOT);
            case '?': return token(TokenType.QUESTION);
            case '+': return token(TokenType.PLUS);
            case '-': return token(TokenType.MINUS);
            case '*': return token(TokenType.STAR);
            case '/': return token(TokenType.SLASH);
            case '%': return token(TokenType.PERCENT);
            case '&': return token(TokenType.AMPERSAND);
            case '|': return token(TokenType.PIPE);
            case '^': return token(TokenType.CARET);
            case '~': return token(TokenType.TILDE);
            case '@': return token(TokenType.AT);
            case '$': return token(TokenType.DOLLAR);
            case '=': return token(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '<': return token(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>': return token(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '!':
                if (match('=')) return token(TokenType.BANG_EQUAL);
                throw error("Unexpected character: !");
            case '"':
                return string();
            case '#':
                return hexColor();
            default:
                if (isDigit(c)) return number();
                if (isAlpha(c)) return identifier();
                throw error("Unexpected character: " + c);
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else {
                return;
            }
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        String lower = text.toLowerCase(Locale.ROOT);

        TokenType type = keywords.get(lower);
        if (type != null) return token(type);
        if (ColorTable.isNamedColor(lower)) {
            return new Token(TokenType.COLORNAME, text, lower, startLine, startColumn);
        }
        return token(TokenType.IDENTIFIER);
    }

    private Token number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        return new Token(TokenType.NUMBER, source.substring(start, current), value, startLine, startColumn);
    }

    private Token string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\') {
                if (isAtEnd()) break;
                char escaped = advance();
                switch (escaped) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    default: sb.append(escaped); break;
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        return new Token(TokenType.STRING, source.substring(start, current), sb.toString(), startLine, startColumn);
    }

    private Token hexColor() {
        while (isHexDigit(peek())) advance();
        int digits = current - start - 1;
        if (digits != 3 && digits != 4 && digits != 6 && digits != 8) {
            throw error("Invalid hex color format: " + source.substring(start, current));
        }
        String text = source.substring(start, current);
        return new Token(TokenType.HEXCOLOR, text, text, startLine, startColumn);
    }

    /** True for hex, rgb(a), hsl(a) and named colors. */
    public static boolean isValidColor(String value) {
        if (value == null) return false;
        String v = value.trim();
        return HEX_PATTERN.matcher(v).matches()
                || RGB_PATTERN.matcher(v).matches()
                || HSL_PATTERN.matcher(v).matches()
                || ColorTable.isNamedColor(v.toLowerCase(Locale.ROOT));
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private Token token(TokenType type) {
        return new Token(type, source.substring(start, current), null, startLine, startColumn);
    }

    private LexException error(String msg) {
        return new LexException("Lexer error at line " + startLine + ", col " + startColumn + ": " + msg,
                startLine, startColumn);
    }
}
