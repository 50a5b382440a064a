package com.example.migrationcompare.application.expression;

import java.util.Set;
import java.util.function.Function;

/**
 * A parsed derived-column expression. Evaluation reads canonical values through the supplied
 * lookup and returns a {@code String}, {@code BigDecimal}, {@code Boolean} or {@code null}.
 */
public interface Expression {

    Object evaluate(Function<String, Object> columns) throws ExpressionEvaluationException;

    /** Canonical columns the expression reads. */
    Set<String> referencedColumns();
}
