package com.groundtruth.extractor.cli;

import com.groundtruth.core.ExtractionRequest;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.config.DetectionSettings;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;

/**
 * Options shared by every command that runs the extractor.
 */
public class EngineOptions {

    @Option(names = {"--entities", "-e"}, defaultValue = "all",
            description = "Comma list of identifier,temporal,relational, or 'all' (default: all)")
    String entities;

    @Option(names = {"--limit"}, description = "Optional per-column scan limit")
    Integer limit;

    @Option(names = {"--max-pairs"}, description = "Relational column pairs scanned per table (default: 2)")
    Integer maxPairs;

    @Option(names = {"--config", "-c"}, description = "JSON file overriding detection keywords and bounds")
    File config;

    ExtractionRequest request() {
        return ExtractionRequest.of(entities, limit);
    }

    DetectionConfig detectionConfig() throws IOException {
        DetectionConfig.Builder builder = DetectionConfig.builder();
        if (config != null) {
            builder.settings(DetectionSettings.load(config.toPath()));
        }
        if (maxPairs != null) {
            builder.maxRelationalPairs(maxPairs);
        }
        return builder.build();
    }
}
