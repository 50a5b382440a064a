package com.example.migrationcompare.infrastructure;

import com.example.migrationcompare.domain.ColumnType;
import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.DuplicateKeyPolicy;
import com.example.migrationcompare.exception.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonMappingResolverTest {
    private final JsonMappingResolver resolver = new JsonMappingResolver(new ObjectMapper());

    @TempDir Path tempDir;

    @Test
    void resolvesDescriptorsSettingsAndVersion() throws IOException {
        Path mapping =
                write(
                        """
                        {
                          "version": "2024-06",
                          "source": {
                            "name": "legacy_accounts",
                            "locations": ["extracts/legacy.csv"],
                            "delimiter": "|",
                            "columnMap": {"acct_no": "ACCOUNT_ID", "bal": "BALANCE"},
                            "primaryKeys": ["ACCOUNT_ID"],
                            "valueColumns": ["BALANCE"],
                            "typeOverrides": {"BALANCE": "DECIMAL"}
                          },
                          "target": {
                            "name": "new_accounts",
                            "locations": ["/data/new.csv"],
                            "primaryKeys": ["ACCOUNT_ID"],
                            "valueColumns": ["BALANCE"]
                          },
                          "settings": {"numericTolerance": 0.01, "duplicateKeyPolicy": "KEEP_FIRST"}
                        }
                        """);

        ComparisonRequest request = resolver.resolve(mapping.toString());

        assertThat(request.mappingVersion()).isEqualTo("2024-06");
        assertThat(request.source().locations())
                .containsExactly(tempDir.resolve("extracts/legacy.csv").toAbsolutePath().normalize().toString());
        assertThat(request.target().locations()).containsExactly(Path.of("/data/new.csv").toString());
        assertThat(request.source().delimiter()).isEqualTo("|");
        assertThat(request.source().encoding()).isEqualTo("UTF-8");
        assertThat(request.source().columnMap()).containsEntry("acct_no", "ACCOUNT_ID");
        assertThat(request.source().typeOf("BALANCE")).isEqualTo(ColumnType.DECIMAL);
        assertThat(request.settings().numericTolerance()).isEqualByComparingTo("0.01");
        assertThat(request.settings().duplicateKeyPolicy()).isEqualTo(DuplicateKeyPolicy.KEEP_FIRST);
    }

    @Test
    void rejectsMissingVersionOrSide() throws IOException {
        Path noVersion = write("{\"source\": {\"name\": \"a\"}, \"target\": {\"name\": \"b\"}, \"settings\": {}}");
        Path noTarget = write("{\"version\": \"1\", \"source\": {\"name\": \"a\"}, \"settings\": {}}");

        assertThatThrownBy(() -> resolver.resolve(noVersion.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no version");
        assertThatThrownBy(() -> resolver.resolve(noTarget.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("source and target");
    }

    @Test
    void rejectsUnknownPropertiesAndMalformedJson() throws IOException {
        Path unknown = write("{\"version\": \"1\", \"sauce\": {}}");
        Path malformed = write("{\"version\": ");

        assertThatThrownBy(() -> resolver.resolve(unknown.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sauce");
        assertThatThrownBy(() -> resolver.resolve(malformed.toString()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void missingDocumentIsAConfigurationError() {
        assertThatThrownBy(() -> resolver.resolve(tempDir.resolve("none.json").toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    private Path write(String json) throws IOException {
        Path file = Files.createTempFile(tempDir, "mapping", ".json");
        Files.writeString(file, json);
        return file;
    }
}
