package com.example.migrationcompare.application.expression;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Recursive-descent parser for derived-column expressions.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := '-' unary | primary
 * primary    := NUMBER | STRING | column | function '(' [expression (',' expression)*] ')'
 *             | '(' expression ')'
 * column     := IDENTIFIER | '`' any text '`'
 * </pre>
 *
 * Strings are single-quoted with {@code ''} as the escaped quote. Arithmetic is decimal and any
 * null operand makes the result null.
 */
public final class ExpressionParser {
    private final String source;
    private final Set<String> knownColumns;
    private int pos;

    private ExpressionParser(String source, Set<String> knownColumns) {
        this.source = source;
        this.knownColumns = knownColumns;
    }

    /**
     * Parses an expression and checks every column it references against {@code knownColumns}.
     *
     * @throws ExpressionSyntaxException on malformed input, unknown functions or unknown columns
     */
    public static Expression parse(String source, Set<String> knownColumns) {
        if (source == null || source.isBlank()) {
            throw new ExpressionSyntaxException("Expression is empty", 0);
        }
        ExpressionParser parser = new ExpressionParser(source, knownColumns);
        Expression expression = parser.parseExpression();
        parser.skipWhitespace();
        if (parser.pos < source.length()) {
            throw new ExpressionSyntaxException(
                    "Unexpected character '" + source.charAt(parser.pos) + "'", parser.pos);
        }
        return expression;
    }

    private Expression parseExpression() {
        Expression left = parseTerm();
        while (true) {
            skipWhitespace();
            if (consume('+')) {
                left = new Arithmetic('+', left, parseTerm());
            } else if (consume('-')) {
                left = new Arithmetic('-', left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Expression parseTerm() {
        Expression left = parseUnary();
        while (true) {
            skipWhitespace();
            if (consume('*')) {
                left = new Arithmetic('*', left, parseUnary());
            } else if (consume('/')) {
                left = new Arithmetic('/', left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Expression parseUnary() {
        skipWhitespace();
        if (consume('-')) {
            return new Negation(parseUnary());
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        skipWhitespace();
        if (pos >= source.length()) {
            throw new ExpressionSyntaxException("Unexpected end of expression", pos);
        }
        char c = source.charAt(pos);
        if (c == '(') {
            pos++;
            Expression inner = parseExpression();
            expect(')');
            return inner;
        }
        if (c == '\'') {
            return new Literal(readString());
        }
        if (c == '`') {
            return column(readQuotedIdentifier());
        }
        if (Character.isDigit(c) || c == '.') {
            return new Literal(readNumber());
        }
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            String identifier = readIdentifier();
            skipWhitespace();
            if (peek('(')) {
                return parseCall(identifier, start);
            }
            return column(identifier);
        }
        throw new ExpressionSyntaxException("Unsupported character '" + c + "'", pos);
    }

    private Expression parseCall(String name, int start) {
        BuiltinFunction function =
                BuiltinFunction.lookup(name)
                        .orElseThrow(
                                () -> new ExpressionSyntaxException("Unknown function '" + name + "'", start));
        expect('(');
        List<Expression> args = new ArrayList<>();
        skipWhitespace();
        if (!consume(')')) {
            do {
                args.add(parseExpression());
                skipWhitespace();
            } while (consume(','));
            expect(')');
        }
        if (!function.accepts(args.size())) {
            throw new ExpressionSyntaxException(
                    "Function '" + name + "' does not take " + args.size() + " argument(s)", start);
        }
        return new Call(function, List.copyOf(args));
    }

    private Expression column(String name) {
        if (!knownColumns.contains(name)) {
            throw new ExpressionSyntaxException("Unknown column '" + name + "'", pos);
        }
        return new ColumnRef(name);
    }

    private String readIdentifier() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private String readQuotedIdentifier() {
        int start = ++pos;
        int end = source.indexOf('`', start);
        if (end < 0) {
            throw new ExpressionSyntaxException("Unterminated quoted column", start - 1);
        }
        pos = end + 1;
        return source.substring(start, end);
    }

    private String readString() {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '\'') {
                if (pos < source.length() && source.charAt(pos) == '\'') {
                    sb.append('\'');
                    pos++;
                } else {
                    return sb.toString();
                }
            } else {
                sb.append(c);
            }
        }
        throw new ExpressionSyntaxException("Unterminated string literal", start);
    }

    private BigDecimal readNumber() {
        int start = pos;
        while (pos < source.length()
                && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        try {
            return new BigDecimal(source.substring(start, pos));
        } catch (NumberFormatException ex) {
            throw new ExpressionSyntaxException("Malformed number", start);
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private boolean peek(char expected) {
        return pos < source.length() && source.charAt(pos) == expected;
    }

    private boolean consume(char expected) {
        if (peek(expected)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        skipWhitespace();
        if (!consume(expected)) {
            throw new ExpressionSyntaxException("Expected '" + expected + "'", pos);
        }
    }

    private record Literal(Object value) implements Expression {
        @Override
        public Object evaluate(Function<String, Object> columns) {
            return value;
        }

        @Override
        public Set<String> referencedColumns() {
            return Set.of();
        }
    }

    private record ColumnRef(String name) implements Expression {
        @Override
        public Object evaluate(Function<String, Object> columns) {
            return columns.apply(name);
        }

        @Override
        public Set<String> referencedColumns() {
            return Set.of(name);
        }
    }

    private record Negation(Expression operand) implements Expression {
        @Override
        public Object evaluate(Function<String, Object> columns) throws ExpressionEvaluationException {
            Object value = operand.evaluate(columns);
            return value == null ? null : BuiltinFunction.number(value).negate();
        }

        @Override
        public Set<String> referencedColumns() {
            return operand.referencedColumns();
        }
    }

    private record Arithmetic(char operator, Expression left, Expression right)
            implements Expression {
        @Override
        public Object evaluate(Function<String, Object> columns) throws ExpressionEvaluationException {
            Object l = left.evaluate(columns);
            Object r = right.evaluate(columns);
            if (l == null || r == null) {
                return null;
            }
            BigDecimal a = BuiltinFunction.number(l);
            BigDecimal b = BuiltinFunction.number(r);
            switch (operator) {
                case '+':
                    return a.add(b);
                case '-':
                    return a.subtract(b);
                case '*':
                    return a.multiply(b);
                default:
                    if (b.signum() == 0) {
                        throw new ExpressionEvaluationException("Division by zero");
                    }
                    return a.divide(b, MathContext.DECIMAL64);
            }
        }

        @Override
        public Set<String> referencedColumns() {
            Set<String> columns = new LinkedHashSet<>(left.referencedColumns());
            columns.addAll(right.referencedColumns());
            return Collections.unmodifiableSet(columns);
        }
    }

    private record Call(BuiltinFunction function, List<Expression> args) implements Expression {
        @Override
        public Object evaluate(Function<String, Object> columns) throws ExpressionEvaluationException {
            List<Object> values = new ArrayList<>(args.size());
            for (Expression arg : args) {
                values.add(arg.evaluate(columns));
            }
            return function.apply(values);
        }

        @Override
        public Set<String> referencedColumns() {
            Set<String> columns = new LinkedHashSet<>();
            for (Expression arg : args) {
                columns.addAll(arg.referencedColumns());
            }
            return Collections.unmodifiableSet(columns);
        }
    }
}
