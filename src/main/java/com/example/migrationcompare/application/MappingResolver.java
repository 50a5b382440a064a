package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.ComparisonRequest;

import java.io.IOException;

/**
 * Builds descriptors and settings for both sides from a versioned mapping definition.
 */
public interface MappingResolver {

    ComparisonRequest resolve(String mappingLocation) throws IOException;
}
