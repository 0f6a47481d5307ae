package work.geodsl.parser;

import java.util.ArrayList;
import java.util.List;
import work.geodsl.error.SyntaxException;

/**
 * Splits one input line into tokens. Whitespace separates tokens and is otherwise ignored.
 */
final class Lexer {
    private Lexer() {}

    static List<Token> tokenize(String input) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = input.length();
        while (i < n) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            switch (c) {
                case '(' -> out.add(new Token(TokenType.LEFT_PAREN, "(", i++));
                case ')' -> out.add(new Token(TokenType.RIGHT_PAREN, ")", i++));
                case '[' -> out.add(new Token(TokenType.LEFT_BRACKET, "[", i++));
                case ']' -> out.add(new Token(TokenType.RIGHT_BRACKET, "]", i++));
                case ',' -> out.add(new Token(TokenType.COMMA, ",", i++));
                case '=' -> out.add(new Token(TokenType.EQUALS, "=", i++));
                case '-' -> out.add(new Token(TokenType.MINUS, "-", i++));
                case '+' -> out.add(new Token(TokenType.PLUS, "+", i++));
                case '"' -> {
                    i = readText(input, i, out);
                }
                default -> {
                    if (Character.isDigit(c) || c == '.') {
                        i = readNumber(input, i, out);
                    } else if (Character.isLetter(c) || c == '_') {
                        while (i < n && isIdentifierPart(input.charAt(i))) {
                            i++;
                        }
                        out.add(new Token(TokenType.IDENTIFIER, input.substring(start, i), start));
                    } else {
                        throw new SyntaxException("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }
        out.add(new Token(TokenType.END, "", n));
        return out;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }

    private static int readNumber(String input, int start, List<Token> out) {
        int n = input.length();
        int i = start;
        boolean seenDot = false;
        boolean seenDigit = false;
        while (i < n) {
            char c = input.charAt(i);
            if (Character.isDigit(c)) {
                seenDigit = true;
            } else if (c == '.') {
                if (seenDot) {
                    throw new SyntaxException("Malformed number literal", start);
                }
                seenDot = true;
            } else {
                break;
            }
            i++;
        }
        if (!seenDigit) {
            throw new SyntaxException("Malformed number literal", start);
        }
        if (i < n && (input.charAt(i) == 'e' || input.charAt(i) == 'E')) {
            int exponent = i + 1;
            if (exponent < n && (input.charAt(exponent) == '+' || input.charAt(exponent) == '-')) {
                exponent++;
            }
            int digits = exponent;
            while (digits < n && Character.isDigit(input.charAt(digits))) {
                digits++;
            }
            if (digits == exponent) {
                throw new SyntaxException("Malformed number literal", start);
            }
            i = digits;
        }
        if (i < n && (Character.isLetter(input.charAt(i)) || input.charAt(i) == '_')) {
            throw new SyntaxException("Malformed number literal", start);
        }
        out.add(new Token(TokenType.NUMBER, input.substring(start, i), start));
        return i;
    }

    private static int readText(String input, int start, List<Token> out) {
        StringBuilder text = new StringBuilder();
        int i = start + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\' && i + 1 < input.length()) {
                text.append(input.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '"') {
                out.add(new Token(TokenType.TEXT, text.toString(), start));
                return i + 1;
            }
            text.append(c);
            i++;
        }
        throw new SyntaxException("Unterminated text literal", start);
    }
}
