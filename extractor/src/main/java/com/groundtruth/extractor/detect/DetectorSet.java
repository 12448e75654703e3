package com.groundtruth.extractor.detect;

import com.groundtruth.core.EntityClass;
import com.groundtruth.extractor.config.DetectionConfig;

import java.util.List;

/**
 * The cell-level detectors, in the order their findings are reported.
 */
public class DetectorSet {
    private final List<Detector> detectors;

    public DetectorSet(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public static DetectorSet standard(DetectionConfig config) {
        return new DetectorSet(List.of(
                new EmailDetector(config),
                new UuidDetector(config),
                new PhoneDetector(config),
                new Ipv4Detector(config),
                new UrlDetector(config),
                new UnixEpochDetector(config),
                new Iso8601Detector(config)
        ));
    }

    public List<Detector> forClass(EntityClass entityClass) {
        return detectors.stream()
                .filter(d -> d.entityClass() == entityClass)
                .toList();
    }
}
