package com.example.migrationcompare.domain;

/**
 * Outcome of joining both datasets for a single comparison key.
 */
public sealed interface AlignedEntry
        permits AlignedEntry.Matched, AlignedEntry.SourceOnly, AlignedEntry.TargetOnly {

    String comparisonKey();

    record Matched(CanonicalRecord source, CanonicalRecord target) implements AlignedEntry {
        @Override
        public String comparisonKey() {
            return source.getComparisonKey();
        }
    }

    record SourceOnly(CanonicalRecord source) implements AlignedEntry {
        @Override
        public String comparisonKey() {
            return source.getComparisonKey();
        }
    }

    record TargetOnly(CanonicalRecord target) implements AlignedEntry {
        @Override
        public String comparisonKey() {
            return target.getComparisonKey();
        }
    }
}
