package com.example.migrationcompare.application;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Builds and splits comparison keys. Key fragments are joined with the ASCII unit separator, which
 * delimited extracts do not carry inside key values; a null key value becomes {@link #NULL_TOKEN}
 * so it can never collide with an empty string or the text {@code "null"}.
 */
public final class ComparisonKeys {
    public static final String SEPARATOR = "\u001F";
    public static final String NULL_TOKEN = "\u0000";

    /** Separator used for the human-readable raw record id. */
    public static final String RECORD_ID_SEPARATOR = "|";

    private ComparisonKeys() {}

    public static String join(List<?> keyValues) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (Object value : keyValues) {
            joiner.add(ValueCoercion.keyText(value));
        }
        return joiner.toString();
    }

    /**
     * Inverse of {@link #join(List)} on the key-text level. Null fragments come back as {@code null}.
     */
    public static List<String> split(String comparisonKey) {
        List<String> parts = new ArrayList<>(Arrays.asList(comparisonKey.split(SEPARATOR, -1)));
        parts.replaceAll(part -> NULL_TOKEN.equals(part) ? null : part);
        return parts;
    }

    /** Readable form for logs and error messages. */
    public static String describe(String comparisonKey) {
        return comparisonKey.replace(SEPARATOR, RECORD_ID_SEPARATOR).replace(NULL_TOKEN, "<null>");
    }
}
