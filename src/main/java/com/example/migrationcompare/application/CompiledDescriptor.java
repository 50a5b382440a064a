package com.example.migrationcompare.application;

import com.example.migrationcompare.application.expression.Expression;
import com.example.migrationcompare.domain.ColumnType;
import com.example.migrationcompare.domain.DatasetDescriptor;

import java.nio.charset.Charset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated descriptor with its derived expressions already parsed. Only
 * {@link DescriptorValidator} creates these.
 */
public final class CompiledDescriptor {
    private final DatasetDescriptor descriptor;
    private final Map<String, String> rawToCanonical;
    private final Map<String, String> canonicalToRaw;
    private final Map<String, Expression> derivedColumns;
    private final Charset charset;

    CompiledDescriptor(
            DatasetDescriptor descriptor, Map<String, Expression> derivedColumns, Charset charset) {
        this.descriptor = descriptor;
        this.rawToCanonical = descriptor.effectiveColumnMap();
        Map<String, String> inverse = new LinkedHashMap<>();
        rawToCanonical.forEach((raw, canonical) -> inverse.putIfAbsent(canonical, raw));
        this.canonicalToRaw = Collections.unmodifiableMap(inverse);
        this.derivedColumns = Collections.unmodifiableMap(new LinkedHashMap<>(derivedColumns));
        this.charset = charset;
    }

    public DatasetDescriptor descriptor() {
        return descriptor;
    }

    public String name() {
        return descriptor.name();
    }

    public Map<String, String> rawToCanonical() {
        return rawToCanonical;
    }

    /** Raw header feeding a canonical column, or {@code null} when the column is derived. */
    public String rawColumnFor(String canonicalColumn) {
        return canonicalToRaw.get(canonicalColumn);
    }

    public Map<String, Expression> derivedColumns() {
        return derivedColumns;
    }

    public List<String> primaryKeys() {
        return descriptor.primaryKeys();
    }

    public List<String> valueColumns() {
        return descriptor.valueColumns();
    }

    public ColumnType typeOf(String canonicalColumn) {
        return descriptor.typeOf(canonicalColumn);
    }

    public boolean hasTypeOverride(String canonicalColumn) {
        return descriptor.typeOverrides().containsKey(canonicalColumn);
    }

    public Charset charset() {
        return charset;
    }
}
