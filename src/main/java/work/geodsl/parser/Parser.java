package work.geodsl.parser;

import java.util.ArrayList;
import java.util.List;
import work.geodsl.error.InvalidInputException;
import work.geodsl.error.SyntaxException;
import work.geodsl.value.DslValue;
import work.geodsl.value.ListValue;
import work.geodsl.value.PointValue;
import work.geodsl.value.ScalarValue;
import work.geodsl.value.TextValue;

/**
 * Recursive-descent parser for {@code label "=" expr | expr}. Pure: it never looks at the
 * construction, so whether a referenced label exists is decided later, at evaluation.
 */
public final class Parser {
    static final int MAX_DEPTH = 256;

    public ParsedExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Empty input");
        }
        return new Cursor(Lexer.tokenize(text)).line();
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int index;
        private int depth;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        ParsedExpression line() {
            if (peek().is(TokenType.EQUALS)) {
                throw new SyntaxException("Missing label before '='", peek().position());
            }
            if (peek().is(TokenType.IDENTIFIER) && peek(1).is(TokenType.EQUALS)) {
                String label = next().text();
                Token equals = next();
                if (peek().is(TokenType.END)) {
                    throw new SyntaxException("Missing expression after '='", equals.position());
                }
                ParsedExpression value = expression();
                expectEnd();
                return new Assignment(label, value);
            }
            ParsedExpression expression = expression();
            expectEnd();
            return expression;
        }

        private ParsedExpression expression() {
            if (++depth > MAX_DEPTH) {
                throw new SyntaxException("Expression nested too deeply", peek().position());
            }
            try {
                return primary();
            } finally {
                depth--;
            }
        }

        private ParsedExpression primary() {
            Token token = next();
            switch (token.type()) {
                case NUMBER:
                    return new Literal(ScalarValue.of(number(token, false)));
                case MINUS:
                case PLUS:
                    Token digits = next();
                    if (!digits.is(TokenType.NUMBER)) {
                        throw new SyntaxException("Sign must be followed by a number", token.position());
                    }
                    return new Literal(ScalarValue.of(number(digits, token.is(TokenType.MINUS))));
                case TEXT:
                    return new Literal(new TextValue(token.text()));
                case IDENTIFIER:
                    if (peek().is(TokenType.LEFT_PAREN)) {
                        next();
                        return new CommandCall(token.text(), arguments(TokenType.RIGHT_PAREN, token));
                    }
                    return new Reference(token.text());
                case LEFT_PAREN:
                    return tuple(token);
                case LEFT_BRACKET:
                    return list(token);
                case RIGHT_PAREN:
                case RIGHT_BRACKET:
                    throw new SyntaxException("Unbalanced brackets: unexpected " + token.describe(), token.position());
                case END:
                    throw new SyntaxException("Unexpected end of input", token.position());
                default:
                    throw new SyntaxException("Unexpected " + token.describe(), token.position());
            }
        }

        private List<ParsedExpression> arguments(TokenType closing, Token opener) {
            List<ParsedExpression> items = new ArrayList<>();
            if (peek().is(closing)) {
                next();
                return items;
            }
            while (true) {
                if (peek().is(TokenType.COMMA) || peek().is(closing)) {
                    throw new SyntaxException("Empty argument", peek().position());
                }
                items.add(expression());
                Token separator = next();
                if (separator.is(TokenType.COMMA)) {
                    continue;
                }
                if (separator.is(closing)) {
                    return items;
                }
                if (separator.is(TokenType.END)) {
                    throw new SyntaxException("Unbalanced brackets: " + opener.describe() + " is never closed", opener.position());
                }
                throw new SyntaxException("Unexpected " + separator.describe(), separator.position());
            }
        }

        private ParsedExpression tuple(Token opener) {
            List<ParsedExpression> items = arguments(TokenType.RIGHT_PAREN, opener);
            if (items.size() == 1) {
                return items.get(0);
            }
            if (items.size() < 2 || items.size() > 3) {
                throw new SyntaxException("Malformed tuple literal", opener.position());
            }
            List<Double> coordinates = new ArrayList<>(items.size());
            for (ParsedExpression item : items) {
                if (!(item instanceof Literal literal) || !(literal.value() instanceof ScalarValue scalar)) {
                    throw new SyntaxException("Tuple coordinates must be numbers", opener.position());
                }
                coordinates.add(scalar.value());
            }
            return new Literal(new PointValue(coordinates));
        }

        private ParsedExpression list(Token opener) {
            List<ParsedExpression> items = arguments(TokenType.RIGHT_BRACKET, opener);
            List<DslValue> values = new ArrayList<>(items.size());
            for (ParsedExpression item : items) {
                if (!(item instanceof Literal literal)) {
                    throw new SyntaxException("List items must be literal values", opener.position());
                }
                values.add(literal.value());
            }
            return new Literal(new ListValue(values));
        }

        private void expectEnd() {
            Token token = peek();
            if (token.is(TokenType.END)) {
                return;
            }
            if (token.is(TokenType.EQUALS)) {
                throw new SyntaxException("Invalid assignment target", token.position());
            }
            if (token.is(TokenType.RIGHT_PAREN) || token.is(TokenType.RIGHT_BRACKET)) {
                throw new SyntaxException("Unbalanced brackets: unexpected " + token.describe(), token.position());
            }
            throw new SyntaxException("Unexpected " + token.describe(), token.position());
        }

        private double number(Token token, boolean negative) {
            try {
                double value = Double.parseDouble(token.text());
                return negative ? -value : value;
            } catch (NumberFormatException ex) {
                throw new SyntaxException("Malformed number literal", token.position());
            }
        }

        private Token peek() {
            return peek(0);
        }

        private Token peek(int offset) {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        private Token next() {
            Token token = peek();
            if (index < tokens.size() - 1) {
                index++;
            }
            return token;
        }
    }
}
