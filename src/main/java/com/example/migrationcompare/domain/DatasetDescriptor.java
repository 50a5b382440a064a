package com.example.migrationcompare.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of one side of a comparison: where the extract lives, how it is encoded
 * and how its raw columns map onto canonical ones.
 *
 * <p>{@code columnMap} maps raw header names to canonical names. When it is empty every declared
 * primary-key and value column that is not derived is mapped onto itself. {@code derivedColumns}
 * keeps declaration order because later expressions may refer to earlier derived columns.
 */
public record DatasetDescriptor(
        String name,
        List<String> locations,
        String delimiter,
        String encoding,
        Map<String, String> columnMap,
        List<String> primaryKeys,
        List<String> valueColumns,
        Map<String, ColumnType> typeOverrides,
        Map<String, String> derivedColumns) {

    public static final String DEFAULT_DELIMITER = ",";
    public static final String DEFAULT_ENCODING = "UTF-8";

    public DatasetDescriptor {
        locations = locations == null ? List.of() : List.copyOf(locations);
        delimiter = delimiter == null || delimiter.isEmpty() ? DEFAULT_DELIMITER : delimiter;
        encoding = encoding == null || encoding.isBlank() ? DEFAULT_ENCODING : encoding;
        columnMap = orderedCopy(columnMap);
        primaryKeys = primaryKeys == null ? List.of() : List.copyOf(primaryKeys);
        valueColumns = valueColumns == null ? List.of() : List.copyOf(valueColumns);
        typeOverrides = orderedCopy(typeOverrides);
        derivedColumns = orderedCopy(derivedColumns);
    }

    /**
     * Raw-to-canonical mapping actually applied to records.
     */
    public Map<String, String> effectiveColumnMap() {
        if (!columnMap.isEmpty()) {
            return columnMap;
        }
        Map<String, String> identity = new LinkedHashMap<>();
        for (String column : declaredColumns()) {
            if (!derivedColumns.containsKey(column)) {
                identity.put(column, column);
            }
        }
        return Collections.unmodifiableMap(identity);
    }

    /** Primary-key columns followed by value columns, without duplicates. */
    public Set<String> declaredColumns() {
        Set<String> columns = new LinkedHashSet<>(primaryKeys);
        columns.addAll(valueColumns);
        return columns;
    }

    public ColumnType typeOf(String canonicalColumn) {
        return typeOverrides.getOrDefault(canonicalColumn, ColumnType.STRING);
    }

    public Optional<String> rawColumnFor(String canonicalColumn) {
        for (Map.Entry<String, String> entry : effectiveColumnMap().entrySet()) {
            if (entry.getValue().equals(canonicalColumn)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    private static <V> Map<String, V> orderedCopy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
