package com.groundtruth.extractor.scan;

/**
 * A table could not be read as a whole. The table is skipped; the run continues.
 */
public class TableScanException extends RuntimeException {
    private final String table;

    public TableScanException(String table, String message) {
        super(message);
        this.table = table;
    }

    public TableScanException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
