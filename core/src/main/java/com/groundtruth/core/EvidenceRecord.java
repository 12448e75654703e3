package com.groundtruth.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One unit of extracted evidence together with the table, column and row it was read from.
 * {@code raw} is only set when {@code value} is a normalized form of the cell (epoch instants).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"entity_type", "subtype", "value", "table", "rowid", "column", "raw"})
public record EvidenceRecord(
        @JsonProperty("entity_type") EntityClass entityType,
        @JsonProperty("subtype") String subtype,
        @JsonProperty("value") String value,
        @JsonProperty("table") String table,
        @JsonProperty("rowid") String rowId,
        @JsonProperty("column") String column,
        @JsonProperty("raw") String raw
) {
    public EvidenceRecord {
        Objects.requireNonNull(entityType, "entityType");
    }

    public static EvidenceRecord identifier(String subtype, String value, String table, String column, String rowId) {
        return new EvidenceRecord(EntityClass.IDENTIFIER, subtype, value, table, rowId, column, null);
    }

    public static EvidenceRecord temporal(String subtype, String value, String raw, String table, String column, String rowId) {
        return new EvidenceRecord(EntityClass.TEMPORAL, subtype, value, table, rowId, column, raw);
    }

    public static EvidenceRecord relational(String subtype, String value, String table, String columns, String rowId) {
        return new EvidenceRecord(EntityClass.RELATIONAL, subtype, value, table, rowId, columns, null);
    }

    /**
     * Identity used for deduplication. {@code raw} is not part of it.
     */
    public Key key() {
        return new Key(entityType, subtype, value, table, rowId, column);
    }

    public record Key(EntityClass entityType, String subtype, String value, String table, String rowId, String column) {}
}
