package com.groundtruth.extractor.introspect;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One column as reported by {@code PRAGMA table_info}. {@code primaryKeyPosition} is the
 * 1-based position within the primary key, or 0 when the column is not a key member.
 */
public record ColumnInfo(
        @JsonProperty("tableName") String tableName,
        @JsonProperty("columnName") String columnName,
        @JsonProperty("declaredType") String declaredType,
        @JsonProperty("typeClass") TypeClass typeClass,
        @JsonProperty("ordinalPosition") int ordinalPosition,
        @JsonProperty("primaryKeyPosition") int primaryKeyPosition,
        @JsonProperty("hints") ColumnHints hints
) {}
