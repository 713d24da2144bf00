package com.reporting.domain.condition;

import com.reporting.domain.exception.ConditionSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits a condition expression into tokens.
 */
public final class ConditionTokenizer {

    static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("AND", TokenType.AND),
            Map.entry("OR", TokenType.OR),
            Map.entry("NOT", TokenType.NOT),
            Map.entry("IN", TokenType.IN),
            Map.entry("CONTAINS", TokenType.CONTAINS),
            Map.entry("EXISTS", TokenType.EXISTS),
            Map.entry("IS_NULL", TokenType.IS_NULL),
            Map.entry("TRUE", TokenType.BOOLEAN),
            Map.entry("FALSE", TokenType.BOOLEAN),
            Map.entry("NULL", TokenType.NULL)
    );

    private final String input;
    private final int length;
    private int pos;

    public ConditionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case '(' -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case ')' -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case '[' -> {
                    advance();
                    tokens.add(new Token(TokenType.LBRACKET, "[", null, start));
                }
                case ']' -> {
                    advance();
                    tokens.add(new Token(TokenType.RBRACKET, "]", null, start));
                }
                case ',' -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", null, start));
                }
                case '=' -> {
                    advance();
                    tokens.add(new Token(TokenType.EQ, match('=') ? "==" : "=", null, start));
                }
                case '!' -> {
                    advance();
                    if (!match('=')) {
                        throw error("Unexpected '!'", start);
                    }
                    tokens.add(new Token(TokenType.NE, "!=", null, start));
                }
                case '>' -> {
                    advance();
                    tokens.add(match('=')
                            ? new Token(TokenType.GTE, ">=", null, start)
                            : new Token(TokenType.GT, ">", null, start));
                }
                case '<' -> {
                    advance();
                    tokens.add(match('=')
                            ? new Token(TokenType.LTE, "<=", null, start)
                            : new Token(TokenType.LT, "<", null, start));
                }
                case '"', '\'' -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (isNumberStart(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        String upper = text.toUpperCase(Locale.ROOT);

        TokenType keyword = KEYWORDS.get(upper);
        if (keyword != null) {
            Object literal = keyword == TokenType.BOOLEAN ? Boolean.valueOf(upper.equals("TRUE")) : null;
            return new Token(keyword, text, literal, start);
        }
        return new Token(TokenType.IDENT, text, text, start);
    }

    private Token readNumber() {
        int start = pos;
        if (peek() == '-') {
            advance();
        }
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == '.') {
            advance();
            while (!isAtEnd() && Character.isDigit(peek())) {
                advance();
            }
        }

        String text = input.substring(start, pos);
        try {
            Object number = text.contains(".") ? Double.parseDouble(text) : Long.parseLong(text);
            return new Token(TokenType.NUMBER, text, number, start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }
        advance(); // closing quote
        return new Token(TokenType.STRING, sb.toString(), sb.toString(), start);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$';
    }

    private boolean isNumberStart(char c) {
        return Character.isDigit(c) || c == '-';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ConditionSyntaxException error(String message, int position) {
        return new ConditionSyntaxException(input, position, message);
    }
}
