package com.groundtruth.extractor.scan;

import java.nio.charset.StandardCharsets;

/**
 * A non-null value read from one column of one row. {@code text} is the value as SQLite
 * renders it, so REAL cells keep their stored form ({@code 1700000000.5}, not {@code 1.7000000005E9}).
 */
public record Cell(String rowId, String column, Object value, String text) {

    public Cell(String rowId, String column, Object value) {
        this(rowId, column, value, asText(value));
    }

    static String asText(Object value) {
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }
}
