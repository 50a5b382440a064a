package com.example.migrationcompare.domain;

public record StepTiming(String phase, double seconds) {}
