package com.example.migrationcompare.domain;

/**
 * What the aligner does when one side carries the same comparison key more than once.
 */
public enum DuplicateKeyPolicy {
    /** Abort the alignment with a duplicate-key failure naming the offending key. */
    FAIL,
    /** Keep the first occurrence in input order and count the rest as collapsed. */
    KEEP_FIRST,
    /** Keep the last occurrence in input order and count the rest as collapsed. */
    KEEP_LAST
}
