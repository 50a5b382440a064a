package com.example.migrationcompare.domain;

import java.util.List;

/**
 * Wall-clock seconds per engine phase, in the order the phases ran. {@code totalSeconds} also
 * covers the time between phases.
 */
public record ComparisonTiming(List<StepTiming> phases, double totalSeconds) {
    public ComparisonTiming {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }
}
