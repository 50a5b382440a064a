package com.example.migrationcompare.application.expression;

public class ExpressionSyntaxException extends RuntimeException {
    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
