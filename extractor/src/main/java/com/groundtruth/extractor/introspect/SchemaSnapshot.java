package com.groundtruth.extractor.introspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.groundtruth.extractor.SkippedTable;

import java.util.List;

public record SchemaSnapshot(
        @JsonProperty("tables") List<TableInfo> tables,
        @JsonProperty("skippedTables") List<SkippedTable> skippedTables
) {}
