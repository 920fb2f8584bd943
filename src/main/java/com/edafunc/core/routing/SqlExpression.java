package com.edafunc.core.routing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A parsed CloudEvents SQL filter expression.
 *
 * Supported subset:
 *   - attribute references:   type, source, subject, any extension name
 *   - literals:               'text', "text", 42, 3.5, TRUE, FALSE
 *   - comparisons:            =  !=  <>  <  <=  >  >=
 *   - pattern match:          source LIKE '/shop/%'   (% any run, _ one char, \ escapes)
 *   - existence:              EXISTS subject
 *   - logic:                  AND, OR, NOT and parentheses
 *
 * Example:
 *   expression = "type LIKE 'order.%' AND NOT (source = '/legacy')"
 *   attributes = {"type": "order.created", "source": "/shop"}
 *   → true
 *
 * Comparing against an attribute the event does not carry is false, never an
 * error. A comparison with a number literal is numeric: the attribute is
 * read as a decimal and the comparison is false when it is not one. Two
 * strings always compare as text, so '007' does not equal '7'.
 */
public final class SqlExpression {

    private final String source;
    private final Node root;

    private SqlExpression(String source, Node root) {
        this.source = source;
        this.root = root;
    }

    public static SqlExpression parse(String expression) {
        Parser parser = new Parser(tokenize(expression));
        Node root = parser.parseOr();
        parser.expect(TokenType.EOF);
        return new SqlExpression(expression, root);
    }

    public boolean evaluate(Map<String, String> attributes) {
        return root.test(attributes);
    }

    @Override
    public String toString() {
        return source;
    }

    // --- AST ---

    private interface Node {
        boolean test(Map<String, String> attributes);
    }

    private interface Operand {
        /** Resolved value, or null when it refers to a missing attribute. */
        Object resolve(Map<String, String> attributes);
    }

    private static Operand attribute(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return attributes -> attributes.get(key);
    }

    private static Operand literal(Object value) {
        return attributes -> value;
    }

    private static Node comparison(Operand left, String operator, Operand right) {
        return attributes -> {
            Object actual = left.resolve(attributes);
            Object expected = right.resolve(attributes);
            if (actual == null || expected == null) {
                return false;
            }
            return compare(actual, expected, operator);
        };
    }

    private static Node like(Operand left, String pattern, boolean negated) {
        Pattern regex = likeToRegex(pattern);
        return attributes -> {
            Object actual = left.resolve(attributes);
            if (actual == null) {
                return false;
            }
            return regex.matcher(actual.toString()).matches() != negated;
        };
    }

    private static Node truthy(Operand operand) {
        return attributes -> {
            Object value = operand.resolve(attributes);
            return value != null && "true".equalsIgnoreCase(value.toString());
        };
    }

    private static boolean compare(Object actual, Object expected, String operator) {
        int cmp;
        if (actual instanceof Number || expected instanceof Number) {
            BigDecimal a = asNumber(actual);
            BigDecimal e = asNumber(expected);
            if (a == null || e == null) {
                return false;
            }
            cmp = a.compareTo(e);
        } else {
            cmp = actual.toString().compareTo(expected.toString());
        }
        return switch (operator) {
            case "=" -> cmp == 0;
            case "!=", "<>" -> cmp != 0;
            case ">" -> cmp > 0;
            case ">=" -> cmp >= 0;
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            default -> false;
        };
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof Long number) {
            return BigDecimal.valueOf(number);
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        if (value instanceof Boolean) {
            return null;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Pattern likeToRegex(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                regex.append(Pattern.quote(String.valueOf(pattern.charAt(++i))));
            } else if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    // --- Tokenizer ---

    private enum TokenType { IDENT, STRING, NUMBER, OPERATOR, LPAREN, RPAREN, EOF }

    private record Token(TokenType type, String text) {

        boolean isKeyword(String keyword) {
            return type == TokenType.IDENT && text.equalsIgnoreCase(keyword);
        }
    }

    private static List<Token> tokenize(String input) {
        if (input == null) {
            throw new FilterSyntaxException("SQL expression is null");
        }
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")"));
                i++;
            } else if (c == '\'' || c == '"') {
                int end = i + 1;
                StringBuilder text = new StringBuilder();
                while (true) {
                    if (end >= input.length()) {
                        throw new FilterSyntaxException("Unterminated string literal in: " + input);
                    }
                    char ch = input.charAt(end);
                    if (ch == c) {
                        // doubled quote is an escaped quote
                        if (end + 1 < input.length() && input.charAt(end + 1) == c) {
                            text.append(c);
                            end += 2;
                            continue;
                        }
                        break;
                    }
                    text.append(ch);
                    end++;
                }
                tokens.add(new Token(TokenType.STRING, text.toString()));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < input.length()
                    && Character.isDigit(input.charAt(i + 1)))) {
                int end = i + 1;
                while (end < input.length()
                        && (Character.isDigit(input.charAt(end)) || input.charAt(end) == '.')) {
                    end++;
                }
                tokens.add(new Token(TokenType.NUMBER, input.substring(i, end)));
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int end = i + 1;
                while (end < input.length()
                        && (Character.isLetterOrDigit(input.charAt(end)) || input.charAt(end) == '_')) {
                    end++;
                }
                tokens.add(new Token(TokenType.IDENT, input.substring(i, end)));
                i = end;
            } else if ("=!<>".indexOf(c) >= 0) {
                String two = i + 1 < input.length() ? input.substring(i, i + 2) : "";
                if (two.equals("!=") || two.equals("<>") || two.equals("<=") || two.equals(">=")) {
                    tokens.add(new Token(TokenType.OPERATOR, two));
                    i += 2;
                } else if (c == '!') {
                    throw new FilterSyntaxException("Unexpected '!' in: " + input);
                } else {
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c)));
                    i++;
                }
            } else {
                throw new FilterSyntaxException("Unexpected character '" + c + "' in: " + input);
            }
        }
        tokens.add(new Token(TokenType.EOF, ""));
        return tokens;
    }

    // --- Parser ---

    private static final class Parser {

        private final List<Token> tokens;
        private int position;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        Node parseOr() {
            Node left = parseAnd();
            while (peek().isKeyword("OR")) {
                next();
                Node l = left;
                Node r = parseAnd();
                left = attributes -> l.test(attributes) || r.test(attributes);
            }
            return left;
        }

        Node parseAnd() {
            Node left = parseUnary();
            while (peek().isKeyword("AND")) {
                next();
                Node l = left;
                Node r = parseUnary();
                left = attributes -> l.test(attributes) && r.test(attributes);
            }
            return left;
        }

        Node parseUnary() {
            if (peek().isKeyword("NOT")) {
                next();
                Node inner = parseUnary();
                return attributes -> !inner.test(attributes);
            }
            return parsePrimary();
        }

        Node parsePrimary() {
            Token token = peek();
            if (token.type() == TokenType.LPAREN) {
                next();
                Node inner = parseOr();
                expect(TokenType.RPAREN);
                return inner;
            }
            if (token.isKeyword("EXISTS")) {
                next();
                Token name = expect(TokenType.IDENT);
                String key = name.text().toLowerCase(Locale.ROOT);
                return attributes -> attributes.containsKey(key);
            }

            Operand left = parseOperand();
            Token after = peek();
            if (after.type() == TokenType.OPERATOR) {
                next();
                return comparison(left, after.text(), parseOperand());
            }
            boolean negated = false;
            if (after.isKeyword("NOT") && lookahead(1).isKeyword("LIKE")) {
                next();
                negated = true;
                after = peek();
            }
            if (after.isKeyword("LIKE")) {
                next();
                Token pattern = expect(TokenType.STRING);
                return like(left, pattern.text(), negated);
            }
            return truthy(left);
        }

        Operand parseOperand() {
            Token token = next();
            return switch (token.type()) {
                case STRING -> literal(token.text());
                case NUMBER -> literal(parseNumber(token.text()));
                case IDENT -> {
                    if (token.isKeyword("TRUE")) {
                        yield literal(Boolean.TRUE);
                    }
                    if (token.isKeyword("FALSE")) {
                        yield literal(Boolean.FALSE);
                    }
                    if (isReserved(token)) {
                        throw new FilterSyntaxException("Unexpected keyword " + token.text());
                    }
                    yield attribute(token.text());
                }
                default -> throw new FilterSyntaxException("Expected a value but found '" + token.text() + "'");
            };
        }

        Token expect(TokenType type) {
            Token token = next();
            if (token.type() != type) {
                throw new FilterSyntaxException("Expected " + type + " but found '" + token.text() + "'");
            }
            return token;
        }

        private Token peek() {
            return tokens.get(position);
        }

        private Token lookahead(int offset) {
            return tokens.get(Math.min(position + offset, tokens.size() - 1));
        }

        private Token next() {
            Token token = tokens.get(position);
            if (token.type() != TokenType.EOF) {
                position++;
            }
            return token;
        }

        private static boolean isReserved(Token token) {
            return token.isKeyword("AND") || token.isKeyword("OR") || token.isKeyword("NOT")
                    || token.isKeyword("LIKE") || token.isKeyword("EXISTS");
        }

        private static Number parseNumber(String raw) {
            try {
                if (raw.contains(".")) {
                    return Double.parseDouble(raw);
                }
                return Long.parseLong(raw);
            } catch (NumberFormatException e) {
                throw new FilterSyntaxException("Invalid number literal: " + raw);
            }
        }
    }
}
