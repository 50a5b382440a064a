package com.example.migrationcompare.application;

import com.example.migrationcompare.application.expression.Expression;
import com.example.migrationcompare.application.expression.ExpressionParser;
import com.example.migrationcompare.application.expression.ExpressionSyntaxException;
import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.ComparisonSettings;
import com.example.migrationcompare.domain.DatasetDescriptor;
import com.example.migrationcompare.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks descriptors and settings before a job exists. Every problem found is collected so a
 * caller sees all of them in one {@link ConfigurationException}.
 */
@Component
public class DescriptorValidator {

    public CompiledComparison validate(ComparisonRequest request) {
        List<String> problems = new ArrayList<>();
        validateSettings(request.settings(), problems);
        CompiledDescriptor source = compile(request.source(), "source", problems);
        CompiledDescriptor target = compile(request.target(), "target", problems);
        if (source != null && target != null) {
            validateSides(request.source(), request.target(), problems);
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        return new CompiledComparison(request, source, target, request.source().valueColumns());
    }

    /** Validates a single descriptor, used when one dataset is browsed on its own. */
    public CompiledDescriptor validate(DatasetDescriptor descriptor) {
        List<String> problems = new ArrayList<>();
        CompiledDescriptor compiled = compile(descriptor, null, problems);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        return compiled;
    }

    private void validateSettings(ComparisonSettings settings, List<String> problems) {
        BigDecimal tolerance = settings.numericTolerance();
        if (tolerance == null) {
            problems.add("Numeric tolerance must be declared for every job");
        } else if (tolerance.signum() < 0) {
            problems.add("Numeric tolerance must not be negative");
        }
    }

    /** {@code side} is null when a dataset is validated on its own. */
    private CompiledDescriptor compile(
            DatasetDescriptor descriptor, String side, List<String> problems) {
        int before = problems.size();
        String prefix = side == null ? "" : side + " ";
        String label = prefix + "dataset '" + descriptor.name() + "'";
        if (descriptor.name() == null || descriptor.name().isBlank()) {
            problems.add("The " + prefix + "dataset has no name");
        }
        if (descriptor.locations().isEmpty()) {
            problems.add("No file location declared for " + label);
        }
        if (descriptor.delimiter().length() != 1) {
            problems.add("Delimiter of " + label + " must be a single character");
        }
        Charset charset = resolveCharset(descriptor.encoding(), label, problems);
        if (descriptor.primaryKeys().isEmpty()) {
            problems.add("No primary key declared for " + label);
        }
        for (String key : descriptor.primaryKeys()) {
            if (descriptor.valueColumns().contains(key)) {
                problems.add("Column '" + key + "' of " + label + " is both key and value column");
            }
        }

        Set<String> mapped = new LinkedHashSet<>(descriptor.effectiveColumnMap().values());
        Map<String, Expression> derived = parseDerived(descriptor, mapped, label, problems);

        for (String key : descriptor.primaryKeys()) {
            if (!mapped.contains(key) && !descriptor.derivedColumns().containsKey(key)) {
                problems.add("Primary key column '" + key + "' of " + label + " has no column mapping");
            }
        }
        for (String value : descriptor.valueColumns()) {
            if (!mapped.contains(value) && !descriptor.derivedColumns().containsKey(value)) {
                problems.add("Value column '" + value + "' of " + label + " has no column mapping");
            }
        }
        for (String column : descriptor.typeOverrides().keySet()) {
            if (!mapped.contains(column) && !descriptor.derivedColumns().containsKey(column)) {
                problems.add("Type override names unknown column '" + column + "' of " + label);
            }
        }
        if (problems.size() > before) {
            return null;
        }
        return new CompiledDescriptor(descriptor, derived, charset);
    }

    private Map<String, Expression> parseDerived(
            DatasetDescriptor descriptor, Set<String> mapped, String label, List<String> problems) {
        Map<String, Expression> parsed = new LinkedHashMap<>();
        Set<String> known = new LinkedHashSet<>(mapped);
        for (Map.Entry<String, String> entry : descriptor.derivedColumns().entrySet()) {
            String column = entry.getKey();
            if (mapped.contains(column)) {
                problems.add("Derived column '" + column + "' of " + label
                        + " clashes with a mapped column");
                continue;
            }
            try {
                parsed.put(column, ExpressionParser.parse(entry.getValue(), known));
            } catch (ExpressionSyntaxException ex) {
                problems.add("Invalid expression for derived column '" + column + "' of " + label
                        + ": " + ex.getMessage());
            }
            known.add(column);
        }
        return parsed;
    }

    private Charset resolveCharset(String encoding, String label, List<String> problems) {
        try {
            return Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            problems.add("Unsupported encoding '" + encoding + "' for " + label);
            return null;
        }
    }

    private void validateSides(
            DatasetDescriptor source, DatasetDescriptor target, List<String> problems) {
        if (source.primaryKeys().size() != target.primaryKeys().size()) {
            problems.add("Source and target declare a different number of primary key columns");
        } else {
            for (int i = 0; i < source.primaryKeys().size(); i++) {
                String sourceKey = source.primaryKeys().get(i);
                String targetKey = target.primaryKeys().get(i);
                if (source.typeOf(sourceKey) != target.typeOf(targetKey)) {
                    problems.add(String.format(
                            "Key column '%s' is %s in source but '%s' is %s in target",
                            sourceKey, source.typeOf(sourceKey), targetKey, target.typeOf(targetKey)));
                }
            }
        }
        Set<String> sourceValues = new LinkedHashSet<>(source.valueColumns());
        Set<String> targetValues = new LinkedHashSet<>(target.valueColumns());
        if (!sourceValues.equals(targetValues)) {
            problems.add("Source value columns " + sourceValues
                    + " do not match target value columns " + targetValues);
        }
    }
}
