package com.groundtruth.extractor.introspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.groundtruth.extractor.config.DetectionConfig;

import java.util.List;
import java.util.Locale;

/**
 * Capability flags derived from a column name alone.
 */
public record ColumnHints(
        @JsonProperty("email") boolean email,
        @JsonProperty("phone") boolean phone,
        @JsonProperty("uuid") boolean uuid,
        @JsonProperty("time") boolean time,
        @JsonProperty("link") boolean link
) {
    public static final ColumnHints NONE = new ColumnHints(false, false, false, false, false);

    public static ColumnHints classify(String columnName, DetectionConfig config) {
        if (columnName == null || columnName.isEmpty()) {
            return NONE;
        }
        String name = columnName.toLowerCase(Locale.ROOT);
        return new ColumnHints(
                containsAny(name, config.emailHints()),
                containsAny(name, config.phoneHints()),
                containsAny(name, config.uuidHints()),
                containsAny(name, config.timeKeywords()),
                config.linkColumn().matcher(columnName).find()
        );
    }

    private static boolean containsAny(String name, List<String> keywords) {
        for (String keyword : keywords) {
            if (name.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
