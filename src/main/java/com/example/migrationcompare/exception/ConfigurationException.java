package com.example.migrationcompare.exception;

import java.util.List;

/**
 * Raised while validating descriptors and settings, before any job exists.
 */
public class ConfigurationException extends RuntimeException {
    private final List<String> problems;

    public ConfigurationException(String message) {
        this(List.of(message));
    }

    public ConfigurationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
