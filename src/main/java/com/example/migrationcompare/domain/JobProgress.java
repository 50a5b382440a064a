package com.example.migrationcompare.domain;

/**
 * Progress snapshot. {@code totalKeys} is an estimate until the job completes and is {@code null}
 * before both inputs have been read.
 */
public record JobProgress(long keysProcessed, Long totalKeys, double percent, String message) {}
