package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.AlignedEntry;
import com.example.migrationcompare.domain.CanonicalRecord;
import com.example.migrationcompare.domain.ComparisonSettings;
import com.example.migrationcompare.domain.DifferenceRecord;
import com.example.migrationcompare.domain.DifferenceType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns one aligned entry into long-format difference rows. All rows for a key share one
 * timestamp taken when that key is classified.
 */
public class DifferenceClassifier {
    private final String jobId;
    private final ValueComparator comparator;
    private final Clock clock;

    public DifferenceClassifier(String jobId, ComparisonSettings settings, Clock clock) {
        this.jobId = jobId;
        this.comparator = new ValueComparator(settings);
        this.clock = clock;
    }

    public List<DifferenceRecord> classify(AlignedEntry entry, List<String> valueColumns) {
        Instant timestamp = clock.instant();
        if (entry instanceof AlignedEntry.SourceOnly sourceOnly) {
            CanonicalRecord source = sourceOnly.source();
            return List.of(new DifferenceRecord(
                    jobId,
                    source.getComparisonKey(),
                    source.getRecordId(),
                    null,
                    DifferenceRecord.RECORD_STATUS_FIELD,
                    DifferenceRecord.PRESENT,
                    DifferenceRecord.MISSING,
                    DifferenceType.MISSING_IN_TARGET,
                    timestamp));
        }
        if (entry instanceof AlignedEntry.TargetOnly targetOnly) {
            CanonicalRecord target = targetOnly.target();
            return List.of(new DifferenceRecord(
                    jobId,
                    target.getComparisonKey(),
                    null,
                    target.getRecordId(),
                    DifferenceRecord.RECORD_STATUS_FIELD,
                    DifferenceRecord.MISSING,
                    DifferenceRecord.PRESENT,
                    DifferenceType.MISSING_IN_SOURCE,
                    timestamp));
        }
        AlignedEntry.Matched matched = (AlignedEntry.Matched) entry;
        CanonicalRecord source = matched.source();
        CanonicalRecord target = matched.target();
        List<DifferenceRecord> differences = new ArrayList<>();
        for (String column : valueColumns) {
            Object sourceValue = source.get(column);
            Object targetValue = target.get(column);
            if (!comparator.equal(sourceValue, targetValue)) {
                differences.add(new DifferenceRecord(
                        jobId,
                        source.getComparisonKey(),
                        source.getRecordId(),
                        target.getRecordId(),
                        column,
                        ValueCoercion.displayText(sourceValue),
                        ValueCoercion.displayText(targetValue),
                        DifferenceType.VALUE_MISMATCH,
                        timestamp));
            }
        }
        return differences;
    }
}
