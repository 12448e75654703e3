package com.groundtruth.core.io;

import java.nio.file.Path;
import java.util.Locale;

public enum RecordFormat {
    JSON("json"),
    CSV("csv");

    private final String extension;

    RecordFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * CSV when the file name ends in {@code .csv}, JSON otherwise.
     */
    public static RecordFormat fromPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") ? CSV : JSON;
    }

    public static RecordFormat parse(String name) {
        for (RecordFormat format : values()) {
            if (format.extension.equalsIgnoreCase(name.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported format: " + name);
    }
}
