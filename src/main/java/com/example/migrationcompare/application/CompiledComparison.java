package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.ComparisonSettings;

import java.util.List;

/**
 * Both sides of a request after validation. Value columns are compared in source declaration
 * order.
 */
public record CompiledComparison(
        ComparisonRequest request,
        CompiledDescriptor source,
        CompiledDescriptor target,
        List<String> valueColumns) {

    public ComparisonSettings settings() {
        return request.settings();
    }
}
