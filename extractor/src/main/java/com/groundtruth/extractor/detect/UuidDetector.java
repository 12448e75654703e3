package com.groundtruth.extractor.detect;

import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.introspect.ColumnInfo;

import java.util.Locale;

public class UuidDetector extends PatternDetector {

    public UuidDetector(DetectionConfig config) {
        super("UUID", config.uuid());
    }

    @Override
    public boolean appliesTo(ColumnInfo column) {
        return super.appliesTo(column) || column.hints().uuid();
    }

    @Override
    protected String normalize(String match) {
        return match.toLowerCase(Locale.ROOT);
    }
}
