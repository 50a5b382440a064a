package com.example.migrationcompare.web;

import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.ComparisonSettings;
import com.example.migrationcompare.domain.DatasetDescriptor;
import com.example.migrationcompare.exception.ConfigurationException;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class SubmitComparisonRequest {
    private DatasetDescriptor source;
    private DatasetDescriptor target;
    private ComparisonSettings settings;

    ComparisonRequest toComparisonRequest() {
        List<String> problems = new ArrayList<>();
        if (source == null) {
            problems.add("Source dataset descriptor is required");
        }
        if (target == null) {
            problems.add("Target dataset descriptor is required");
        }
        if (settings == null) {
            problems.add("Comparison settings are required");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        return new ComparisonRequest(source, target, settings);
    }
}
