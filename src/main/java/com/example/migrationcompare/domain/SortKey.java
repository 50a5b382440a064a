package com.example.migrationcompare.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * One level of a multi-level result ordering, named by output column.
 */
public record SortKey(String column, Direction direction) {
    public enum Direction {
        ASC,
        DESC
    }

    public SortKey {
        Objects.requireNonNull(column, "column");
        direction = direction == null ? Direction.ASC : direction;
    }

    public static SortKey asc(String column) {
        return new SortKey(column, Direction.ASC);
    }

    public static SortKey desc(String column) {
        return new SortKey(column, Direction.DESC);
    }

    /**
     * Parses {@code column} or {@code column,asc|desc}.
     */
    public static SortKey parse(String expression) {
        String[] parts = expression.split(",", 2);
        String column = parts[0].trim();
        if (column.isEmpty()) {
            throw new IllegalArgumentException("Sort column must not be empty");
        }
        if (parts.length == 1 || parts[1].isBlank()) {
            return asc(column);
        }
        return new SortKey(column, Direction.valueOf(parts[1].trim().toUpperCase(Locale.ROOT)));
    }
}
