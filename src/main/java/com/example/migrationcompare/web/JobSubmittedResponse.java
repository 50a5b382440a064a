package com.example.migrationcompare.web;

public record JobSubmittedResponse(String jobId, String statusLocation, String resultLocation) {}
