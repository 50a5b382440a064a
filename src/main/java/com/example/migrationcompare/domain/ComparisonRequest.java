package com.example.migrationcompare.domain;

import java.util.Objects;

public record ComparisonRequest(
        DatasetDescriptor source,
        DatasetDescriptor target,
        ComparisonSettings settings,
        String mappingVersion) {
    public ComparisonRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(settings, "settings");
    }

    public ComparisonRequest(
            DatasetDescriptor source, DatasetDescriptor target, ComparisonSettings settings) {
        this(source, target, settings, null);
    }
}
