package com.example.migrationcompare.application.expression;

import com.example.migrationcompare.application.ValueCoercion;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Functions callable from derived-column expressions. Anything not listed here is rejected when
 * the expression is parsed.
 */
enum BuiltinFunction {
    CONCAT(1, Integer.MAX_VALUE) {
        @Override
        Object apply(List<Object> args) {
            StringBuilder sb = new StringBuilder();
            for (Object arg : args) {
                if (arg != null) {
                    sb.append(text(arg));
                }
            }
            return sb.toString();
        }
    },
    UPPER(1, 1) {
        @Override
        Object apply(List<Object> args) {
            return args.get(0) == null ? null : text(args.get(0)).toUpperCase(Locale.ROOT);
        }
    },
    LOWER(1, 1) {
        @Override
        Object apply(List<Object> args) {
            return args.get(0) == null ? null : text(args.get(0)).toLowerCase(Locale.ROOT);
        }
    },
    TRIM(1, 1) {
        @Override
        Object apply(List<Object> args) {
            return args.get(0) == null ? null : text(args.get(0)).strip();
        }
    },
    COALESCE(1, Integer.MAX_VALUE) {
        @Override
        Object apply(List<Object> args) {
            for (Object arg : args) {
                if (arg != null) {
                    return arg;
                }
            }
            return null;
        }
    },
    ABS(1, 1) {
        @Override
        Object apply(List<Object> args) throws ExpressionEvaluationException {
            return args.get(0) == null ? null : number(args.get(0)).abs();
        }
    },
    ROUND(1, 2) {
        @Override
        Object apply(List<Object> args) throws ExpressionEvaluationException {
            if (args.get(0) == null) {
                return null;
            }
            int scale = args.size() > 1 ? number(args.get(1)).intValue() : 0;
            return number(args.get(0)).setScale(scale, RoundingMode.HALF_UP);
        }
    },
    SUBSTR(2, 3) {
        @Override
        Object apply(List<Object> args) throws ExpressionEvaluationException {
            if (args.get(0) == null) {
                return null;
            }
            String value = text(args.get(0));
            int start = Math.max(0, number(args.get(1)).intValue() - 1);
            if (start >= value.length()) {
                return "";
            }
            int end = args.size() > 2
                    ? Math.min(value.length(), start + Math.max(0, number(args.get(2)).intValue()))
                    : value.length();
            return value.substring(start, end);
        }
    };

    private final int minArgs;
    private final int maxArgs;

    BuiltinFunction(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    abstract Object apply(List<Object> args) throws ExpressionEvaluationException;

    boolean accepts(int argumentCount) {
        return argumentCount >= minArgs && argumentCount <= maxArgs;
    }

    static Optional<BuiltinFunction> lookup(String name) {
        for (BuiltinFunction function : values()) {
            if (function.name().equalsIgnoreCase(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    static String text(Object value) {
        return ValueCoercion.displayText(value);
    }

    static BigDecimal number(Object value) throws ExpressionEvaluationException {
        if (value == null) {
            throw new ExpressionEvaluationException("Null used where a number is required");
        }
        try {
            return ValueCoercion.toDecimal(value);
        } catch (IllegalArgumentException ex) {
            throw new ExpressionEvaluationException(ex.getMessage(), ex);
        }
    }
}
