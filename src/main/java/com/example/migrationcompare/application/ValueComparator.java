package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.ComparisonSettings;
import com.example.migrationcompare.domain.ToleranceMode;

import java.math.BigDecimal;

/**
 * Type-aware equality of two canonical values. Null equals null and nothing else. Numbers compare
 * by value within the job's tolerance, so {@code 100.0} and {@code 100.00} are equal even at zero
 * tolerance. A number and a numeric string are compared as numbers.
 */
public class ValueComparator {
    private final BigDecimal tolerance;
    private final ToleranceMode mode;
    private final boolean ignoreCase;

    public ValueComparator(ComparisonSettings settings) {
        this.tolerance = settings.numericTolerance() == null ? BigDecimal.ZERO : settings.numericTolerance();
        this.mode = settings.toleranceMode();
        this.ignoreCase = settings.ignoreCase();
    }

    public boolean equal(Object source, Object target) {
        if (source == null || target == null) {
            return source == null && target == null;
        }
        if (ValueCoercion.isNumeric(source) || ValueCoercion.isNumeric(target)) {
            BigDecimal a = asNumber(source);
            BigDecimal b = asNumber(target);
            if (a != null && b != null) {
                return withinTolerance(a, b);
            }
        }
        if (source instanceof String a && target instanceof String b) {
            return ignoreCase ? a.equalsIgnoreCase(b) : a.equals(b);
        }
        if (source.getClass() == target.getClass()) {
            return source.equals(target);
        }
        String a = ValueCoercion.displayText(source);
        String b = ValueCoercion.displayText(target);
        return ignoreCase ? a.equalsIgnoreCase(b) : a.equals(b);
    }

    private boolean withinTolerance(BigDecimal a, BigDecimal b) {
        BigDecimal difference = a.subtract(b).abs();
        if (mode == ToleranceMode.RELATIVE) {
            BigDecimal scale = a.abs().max(b.abs());
            return difference.compareTo(tolerance.multiply(scale)) <= 0;
        }
        return difference.compareTo(tolerance) <= 0;
    }

    private static BigDecimal asNumber(Object value) {
        if (ValueCoercion.isNumeric(value)) {
            return ValueCoercion.toDecimal(value);
        }
        if (value instanceof String text) {
            try {
                return ValueCoercion.parseDecimal(text);
            } catch (IllegalArgumentException ex) {
                return null;
            }
        }
        return null;
    }
}
