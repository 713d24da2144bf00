package com.reporting.domain.condition;

/**
 * @param type     token type
 * @param text     source text
 * @param literal  parsed value for strings, numbers and booleans
 * @param position offset in the expression
 */
public record Token(TokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        return type + "(" + (literal != null ? literal : text) + ")";
    }
}
