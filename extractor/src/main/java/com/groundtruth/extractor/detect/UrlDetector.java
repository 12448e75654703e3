package com.groundtruth.extractor.detect;

import com.groundtruth.extractor.config.DetectionConfig;

public class UrlDetector extends PatternDetector {

    public UrlDetector(DetectionConfig config) {
        super("URL", config.url());
    }
}
