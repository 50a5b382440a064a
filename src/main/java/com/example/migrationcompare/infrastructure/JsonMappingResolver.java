package com.example.migrationcompare.infrastructure;

import com.example.migrationcompare.application.MappingResolver;
import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.ComparisonSettings;
import com.example.migrationcompare.domain.DatasetDescriptor;
import com.example.migrationcompare.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a versioned JSON mapping document:
 *
 * <pre>
 * {
 *   "version": "2024-06",
 *   "source":   { "name": ..., "locations": [...], "columnMap": {...}, "primaryKeys": [...], ... },
 *   "target":   { ... },
 *   "settings": { "numericTolerance": 0.01, "duplicateKeyPolicy": "FAIL", ... }
 * }
 * </pre>
 *
 * Relative file locations are resolved against the directory of the mapping document. Unknown
 * properties are rejected.
 */
@Component
public class JsonMappingResolver implements MappingResolver {
    private static final Logger log = LogManager.getLogger(JsonMappingResolver.class);

    private final ObjectReader reader;

    public JsonMappingResolver(ObjectMapper objectMapper) {
        this.reader =
                objectMapper
                        .readerFor(MappingDocument.class)
                        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public ComparisonRequest resolve(String mappingLocation) throws IOException {
        Path path = Path.of(mappingLocation);
        MappingDocument document;
        try {
            document = reader.readValue(Files.readString(path));
        } catch (NoSuchFileException ex) {
            throw new ConfigurationException("Mapping document not found: " + mappingLocation);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException(
                    "Invalid mapping document " + mappingLocation + ": " + ex.getOriginalMessage());
        }
        if (document.version() == null || document.version().isBlank()) {
            throw new ConfigurationException("Mapping document " + mappingLocation + " has no version");
        }
        if (document.source() == null || document.target() == null) {
            throw new ConfigurationException(
                    "Mapping document " + mappingLocation + " must declare both source and target");
        }
        if (document.settings() == null) {
            throw new ConfigurationException(
                    "Mapping document " + mappingLocation + " must declare comparison settings");
        }
        Path baseDirectory = path.toAbsolutePath().getParent();
        log.info("Resolved mapping {} version {}", mappingLocation, document.version());
        return new ComparisonRequest(
                resolveLocations(document.source(), baseDirectory),
                resolveLocations(document.target(), baseDirectory),
                document.settings(),
                document.version());
    }

    private static DatasetDescriptor resolveLocations(DatasetDescriptor descriptor, Path baseDirectory) {
        List<String> locations =
                descriptor.locations().stream()
                        .map(location -> baseDirectory.resolve(location).normalize().toString())
                        .toList();
        return new DatasetDescriptor(
                descriptor.name(),
                locations,
                descriptor.delimiter(),
                descriptor.encoding(),
                descriptor.columnMap(),
                descriptor.primaryKeys(),
                descriptor.valueColumns(),
                descriptor.typeOverrides(),
                descriptor.derivedColumns());
    }

    record MappingDocument(
            String version,
            DatasetDescriptor source,
            DatasetDescriptor target,
            ComparisonSettings settings) {}
}
