package com.groundtruth.extractor.scan;

/**
 * Two non-null values read from the same row, with their SQLite text forms.
 */
public record CellPair(String rowId, Object first, Object second, String firstText, String secondText) {

    public CellPair(String rowId, Object first, Object second) {
        this(rowId, first, second, Cell.asText(first), Cell.asText(second));
    }
}
