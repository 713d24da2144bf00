package com.reporting.domain.condition;

import com.reporting.domain.exception.ConditionSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for rule conditions.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('OR' and)*
 * and        := not ('AND' not)*
 * not        := 'NOT' not | primary
 * primary    := '(' expression ')' | 'TRUE' | 'FALSE' | comparison
 * comparison := path operator value | path ['NOT'] 'IN' list
 *             | path 'CONTAINS' value | path 'EXISTS' | path 'IS_NULL'
 * </pre>
 */
public final class ConditionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ConditionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    public static Condition compile(String expression) {
        return new ConditionParser(expression, new ConditionTokenizer(expression).tokenize()).parse();
    }

    public Condition parse() {
        Condition result = parseOr();
        expect(TokenType.EOF);
        return result;
    }

    private Condition parseOr() {
        List<Condition> conditions = new ArrayList<>();
        conditions.add(parseAnd());
        while (match(TokenType.OR)) {
            conditions.add(parseAnd());
        }
        return conditions.size() == 1 ? conditions.get(0) : new Conditions.Or(List.copyOf(conditions));
    }

    private Condition parseAnd() {
        List<Condition> conditions = new ArrayList<>();
        conditions.add(parseNot());
        while (match(TokenType.AND)) {
            conditions.add(parseNot());
        }
        return conditions.size() == 1 ? conditions.get(0) : new Conditions.And(List.copyOf(conditions));
    }

    private Condition parseNot() {
        if (match(TokenType.NOT)) {
            return new Conditions.Not(parseNot());
        }
        return parsePrimary();
    }

    private Condition parsePrimary() {
        if (match(TokenType.LPAREN)) {
            Condition expr = parseOr();
            expect(TokenType.RPAREN);
            return expr;
        }
        if (match(TokenType.BOOLEAN)) {
            return new Conditions.Constant((Boolean) previous().literal());
        }
        return parseComparison();
    }

    private Condition parseComparison() {
        String path = consume(TokenType.IDENT, "Expected field path").text();

        if (match(TokenType.EXISTS)) {
            return new Conditions.Exists(path);
        }
        if (match(TokenType.IS_NULL)) {
            return new Conditions.IsNull(path);
        }
        if (match(TokenType.NOT)) {
            if (match(TokenType.IN)) {
                return new Conditions.In(path, parseList(), true);
            }
            throw error("Expected IN after NOT");
        }
        if (match(TokenType.IN)) {
            return new Conditions.In(path, parseList(), false);
        }
        if (match(TokenType.CONTAINS)) {
            return new Conditions.Contains(path, parseValue());
        }
        if (match(TokenType.EQ)) {
            return new Conditions.Compare(path, Conditions.Comparison.EQ, parseValue());
        }
        if (match(TokenType.NE)) {
            return new Conditions.Compare(path, Conditions.Comparison.NE, parseValue());
        }
        if (match(TokenType.GTE)) {
            return new Conditions.Compare(path, Conditions.Comparison.GTE, parseNumber(">="));
        }
        if (match(TokenType.GT)) {
            return new Conditions.Compare(path, Conditions.Comparison.GT, parseNumber(">"));
        }
        if (match(TokenType.LTE)) {
            return new Conditions.Compare(path, Conditions.Comparison.LTE, parseNumber("<="));
        }
        if (match(TokenType.LT)) {
            return new Conditions.Compare(path, Conditions.Comparison.LT, parseNumber("<"));
        }

        throw error("Expected operator after '" + path + "'");
    }

    private List<Object> parseList() {
        boolean bracket = match(TokenType.LBRACKET);
        if (!bracket) {
            expect(TokenType.LPAREN);
        }
        TokenType closing = bracket ? TokenType.RBRACKET : TokenType.RPAREN;

        List<Object> values = new ArrayList<>();
        if (!check(closing)) {
            values.add(parseValue());
            while (match(TokenType.COMMA)) {
                values.add(parseValue());
            }
        }
        expect(closing);
        return values;
    }

    private Object parseValue() {
        if (match(TokenType.STRING, TokenType.NUMBER, TokenType.BOOLEAN, TokenType.NULL, TokenType.IDENT)) {
            return previous().literal();
        }
        throw error("Expected value");
    }

    private Object parseNumber(String operator) {
        if (match(TokenType.NUMBER)) {
            return previous().literal();
        }
        throw error(operator + " requires a numeric value");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (peek().type() != TokenType.EOF) {
            index++;
        }
        return previous();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ConditionSyntaxException error(String message) {
        return new ConditionSyntaxException(input, peek().position(), message);
    }
}
