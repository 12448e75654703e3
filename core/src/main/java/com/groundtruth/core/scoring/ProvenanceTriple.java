package com.groundtruth.core.scoring;

/**
 * The (value, table, rowid) coordinates used to match a finding against the gold set.
 */
public record ProvenanceTriple(String value, String table, String rowId) {

    public static ProvenanceTriple of(Object value, Object table, Object rowId) {
        return new ProvenanceTriple(normalize(value), normalize(table), normalize(rowId));
    }

    public boolean isComplete() {
        return !value.isEmpty() && !table.isEmpty() && !rowId.isEmpty();
    }

    private static String normalize(Object value) {
        return value == null ? "" : value.toString().trim();
    }
}
