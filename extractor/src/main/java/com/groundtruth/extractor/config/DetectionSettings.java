package com.groundtruth.extractor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Optional JSON overrides for {@link DetectionConfig}. Absent fields keep their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DetectionSettings(
        @JsonProperty("emailHints") List<String> emailHints,
        @JsonProperty("phoneHints") List<String> phoneHints,
        @JsonProperty("uuidHints") List<String> uuidHints,
        @JsonProperty("timeKeywords") List<String> timeKeywords,
        @JsonProperty("minPhoneDigits") Integer minPhoneDigits,
        @JsonProperty("maxPhoneDigits") Integer maxPhoneDigits,
        @JsonProperty("epochLowerBound") Long epochLowerBound,
        @JsonProperty("epochUpperBound") Long epochUpperBound,
        @JsonProperty("maxRelationalPairs") Integer maxRelationalPairs
) {
    public static DetectionSettings load(Path file) throws IOException {
        return new ObjectMapper().readValue(file.toFile(), DetectionSettings.class);
    }
}
