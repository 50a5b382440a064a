package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.AlignedEntry;

import java.util.List;

/**
 * Aligned entries of one partition plus the number of duplicates collapsed on each side.
 */
public record AlignmentResult(
        List<AlignedEntry> entries, long sourceDuplicates, long targetDuplicates) {}
