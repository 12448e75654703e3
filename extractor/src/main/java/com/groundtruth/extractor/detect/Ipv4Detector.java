package com.groundtruth.extractor.detect;

import com.groundtruth.extractor.config.DetectionConfig;

public class Ipv4Detector extends PatternDetector {

    public Ipv4Detector(DetectionConfig config) {
        super("IPv4", config.ipv4());
    }
}
