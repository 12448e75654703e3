package com.groundtruth.extractor.detect;

import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.introspect.ColumnInfo;

public class EmailDetector extends PatternDetector {

    public EmailDetector(DetectionConfig config) {
        super("Email", config.email());
    }

    @Override
    public boolean appliesTo(ColumnInfo column) {
        return super.appliesTo(column) || column.hints().email();
    }
}
