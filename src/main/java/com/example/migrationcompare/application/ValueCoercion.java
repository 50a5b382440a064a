package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.ColumnType;
import com.example.migrationcompare.domain.DifferenceRecord;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Type coercion and canonical text forms of canonical values.
 *
 * <p>Two text forms exist. {@link #keyText(Object)} is type-stable and scale-insensitive so that
 * {@code "007"} as an integer and {@code 7.00} as a decimal produce the same key fragment.
 * {@link #displayText(Object)} keeps the scale of decimals so reports show {@code 100.00} rather
 * than {@code 100}.
 */
public final class ValueCoercion {
    private static final Set<String> TRUE_LITERALS = Set.of("true", "t", "yes", "y", "1");
    private static final Set<String> FALSE_LITERALS = Set.of("false", "f", "no", "n", "0");

    private ValueCoercion() {}

    /**
     * Coerces a value to the declared type. Strings are parsed, numbers are converted, {@code null}
     * stays {@code null}.
     *
     * @throws IllegalArgumentException when the value cannot represent the type
     */
    public static Object coerce(Object value, ColumnType type) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case STRING -> value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString();
            case INTEGER -> toInteger(value);
            case DECIMAL -> toDecimal(value);
            case BOOLEAN -> toBoolean(value);
        };
    }

    /**
     * Parses a numeric text the way amount columns arrive from extracts: thousands separators are
     * dropped, and accounting parentheses or a trailing minus sign mark a negative value.
     */
    public static BigDecimal parseDecimal(String text) {
        String cleaned = text.strip().replace(",", "");
        boolean negative = false;
        if (cleaned.startsWith("(") && cleaned.endsWith(")")) {
            negative = true;
            cleaned = cleaned.substring(1, cleaned.length() - 1).strip();
        } else if (cleaned.length() > 1 && cleaned.endsWith("-")) {
            negative = true;
            cleaned = cleaned.substring(0, cleaned.length() - 1).strip();
        }
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("Empty numeric value");
        }
        try {
            BigDecimal parsed = new BigDecimal(cleaned);
            return negative ? parsed.negate() : parsed;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Not a number: '" + text + "'", ex);
        }
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Long || value instanceof BigDecimal;
    }

    public static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Long number) {
            return BigDecimal.valueOf(number);
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof Boolean) {
            throw new IllegalArgumentException("Boolean cannot be used as a number");
        }
        return parseDecimal(value.toString());
    }

    private static Long toInteger(Object value) {
        BigDecimal decimal = toDecimal(value).stripTrailingZeros();
        if (decimal.scale() > 0) {
            throw new IllegalArgumentException("Not an integer: '" + value + "'");
        }
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Integer out of range: '" + value + "'", ex);
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = value.toString().strip().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(text)) {
            return Boolean.TRUE;
        }
        if (FALSE_LITERALS.contains(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: '" + value + "'");
    }

    public static String keyText(Object value) {
        if (value == null) {
            return ComparisonKeys.NULL_TOKEN;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    public static String displayText(Object value) {
        if (value == null) {
            return DifferenceRecord.NULL_VALUE;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }
}
