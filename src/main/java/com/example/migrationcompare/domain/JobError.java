package com.example.migrationcompare.domain;

public record JobError(JobErrorCode code, String detail) {}
