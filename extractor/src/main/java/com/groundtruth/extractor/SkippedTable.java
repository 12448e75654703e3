package com.groundtruth.extractor;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SkippedTable(
        @JsonProperty("table") String table,
        @JsonProperty("reason") String reason
) {}
