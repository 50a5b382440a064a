package com.example.migrationcompare.domain;

public enum ToleranceMode {
    /** {@code |a - b| <= epsilon} */
    ABSOLUTE,
    /** {@code |a - b| <= epsilon * max(|a|, |b|)} */
    RELATIVE
}
