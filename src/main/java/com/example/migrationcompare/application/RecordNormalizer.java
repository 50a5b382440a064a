package com.example.migrationcompare.application;

import com.example.migrationcompare.application.expression.Expression;
import com.example.migrationcompare.application.expression.ExpressionEvaluationException;
import com.example.migrationcompare.domain.CanonicalRecord;
import com.example.migrationcompare.domain.ComparisonSettings;
import com.example.migrationcompare.domain.RawRecord;
import com.example.migrationcompare.exception.NormalizationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Turns raw rows into canonical records: rename, coerce, derive, then build the comparison key.
 * Instances are stateless apart from the settings and safe to share between threads.
 */
public class RecordNormalizer {
    private final boolean trimStrings;
    private final boolean treatEmptyAsNull;

    public RecordNormalizer(ComparisonSettings settings) {
        this.trimStrings = settings.trimStrings();
        this.treatEmptyAsNull = settings.treatEmptyAsNull();
    }

    public CanonicalRecord normalize(RawRecord raw, CompiledDescriptor descriptor)
            throws NormalizationException {
        requireColumns(raw, descriptor, descriptor.primaryKeys());
        requireColumns(raw, descriptor, descriptor.valueColumns());

        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> mapping : descriptor.rawToCanonical().entrySet()) {
            if (!raw.hasColumn(mapping.getKey())) {
                continue;
            }
            String canonical = mapping.getValue();
            String text = prepare(raw.get(mapping.getKey()));
            values.put(canonical, coerce(text, canonical, descriptor, raw));
        }

        for (Map.Entry<String, Expression> derived : descriptor.derivedColumns().entrySet()) {
            String column = derived.getKey();
            Object value;
            try {
                value = derived.getValue().evaluate(values::get);
            } catch (ExpressionEvaluationException ex) {
                throw new NormalizationException(
                        NormalizationException.Kind.TYPE_COERCION_FAILURE,
                        column,
                        "Row " + raw.rowNumber() + ": cannot derive '" + column + "': " + ex.getMessage());
            }
            if (descriptor.hasTypeOverride(column)) {
                value = coerce(value, column, descriptor, raw);
            }
            values.put(column, value);
        }

        List<Object> keyValues = new ArrayList<>(descriptor.primaryKeys().size());
        StringJoiner recordId = new StringJoiner(ComparisonKeys.RECORD_ID_SEPARATOR);
        for (String key : descriptor.primaryKeys()) {
            Object value = values.get(key);
            keyValues.add(value);
            String rawColumn = descriptor.rawColumnFor(key);
            if (rawColumn != null) {
                String rawText = raw.get(rawColumn);
                recordId.add(rawText == null ? "" : rawText);
            } else {
                recordId.add(value == null ? "" : ValueCoercion.displayText(value));
            }
        }
        return new CanonicalRecord(
                ComparisonKeys.join(keyValues), recordId.toString(), raw.rowNumber(), values);
    }

    private void requireColumns(RawRecord raw, CompiledDescriptor descriptor, List<String> columns)
            throws NormalizationException {
        for (String column : columns) {
            String rawColumn = descriptor.rawColumnFor(column);
            if (rawColumn != null && !raw.hasColumn(rawColumn)) {
                throw new NormalizationException(
                        NormalizationException.Kind.MISSING_REQUIRED_COLUMN,
                        column,
                        "Row " + raw.rowNumber() + " has no column '" + rawColumn + "'");
            }
        }
    }

    private String prepare(String text) {
        if (text == null) {
            return null;
        }
        String value = trimStrings ? text.strip() : text;
        if (treatEmptyAsNull && value.isEmpty()) {
            return null;
        }
        return value;
    }

    private Object coerce(Object value, String column, CompiledDescriptor descriptor, RawRecord raw)
            throws NormalizationException {
        try {
            return ValueCoercion.coerce(value, descriptor.typeOf(column));
        } catch (IllegalArgumentException ex) {
            throw new NormalizationException(
                    NormalizationException.Kind.TYPE_COERCION_FAILURE,
                    column,
                    String.format(
                            "Row %d: column '%s' is not %s: %s",
                            raw.rowNumber(), column, descriptor.typeOf(column), ex.getMessage()));
        }
    }
}
