package com.example.migrationcompare.application.expression;

/**
 * The expression is valid but cannot be evaluated for the values of one record.
 */
public class ExpressionEvaluationException extends Exception {
    public ExpressionEvaluationException(String message) {
        super(message);
    }

    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
