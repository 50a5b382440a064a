package com.example.migrationcompare.domain;

import java.util.Map;

/**
 * One data row as read from a delimited file, keyed by raw header name.
 */
public record RawRecord(long rowNumber, String location, Map<String, String> fields) {
    public RawRecord {
        fields = fields == null ? Map.of() : fields;
    }

    public boolean hasColumn(String rawColumn) {
        return fields.containsKey(rawColumn);
    }

    public String get(String rawColumn) {
        return fields.get(rawColumn);
    }
}
