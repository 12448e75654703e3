package com.groundtruth.extractor.introspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.groundtruth.extractor.identity.PrimaryKeySpec;

import java.util.List;

public record TableInfo(
        @JsonProperty("name") String name,
        @JsonProperty("columns") List<ColumnInfo> columns,
        @JsonProperty("identity") PrimaryKeySpec identity
) {}
