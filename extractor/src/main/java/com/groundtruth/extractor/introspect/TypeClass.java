package com.groundtruth.extractor.introspect;

import java.util.Locale;

/**
 * SQLite-style affinity folding of a declared column type.
 */
public enum TypeClass {
    TEXT,
    INTEGER,
    REAL,
    OTHER;

    public static TypeClass of(String declaredType) {
        String t = declaredType == null ? "" : declaredType.toUpperCase(Locale.ROOT);
        if (t.contains("CHAR") || t.contains("TEXT") || t.contains("CLOB")) {
            return TEXT;
        }
        if (t.contains("INT")) {
            return INTEGER;
        }
        if (t.contains("REAL") || t.contains("FLOA") || t.contains("DOUB")) {
            return REAL;
        }
        return OTHER;
    }
}
