package com.example.migrationcompare.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Job-level row counts. These, not the number of difference rows, tell "fully matched" apart
 * from "not compared".
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonSummary {
    private long sourceRowsRead;
    private long targetRowsRead;
    private long sourceRowsSkipped;
    private long targetRowsSkipped;
    private long sourceDuplicatesCollapsed;
    private long targetDuplicatesCollapsed;
    private long keysCompared;
    private long matchedKeys;
    private long mismatchedKeys;
    private long sourceOnlyKeys;
    private long targetOnlyKeys;
    private long differenceRows;
    private ComparisonTiming timing;
}
