package com.groundtruth.extractor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ExtractionResult(
        @JsonProperty("database") String database,
        @JsonProperty("records") List<EvidenceRecord> records,
        @JsonProperty("skippedTables") List<SkippedTable> skippedTables
) {
    public ExtractionResult {
        records = List.copyOf(records);
        skippedTables = List.copyOf(skippedTables);
    }

    /**
     * Number of records per entity class, with every class present.
     */
    public Map<EntityClass, Integer> counts() {
        Map<EntityClass, Integer> counts = new EnumMap<>(EntityClass.class);
        for (EntityClass entityClass : EntityClass.values()) {
            counts.put(entityClass, 0);
        }
        for (EvidenceRecord record : records) {
            counts.merge(record.entityType(), 1, Integer::sum);
        }
        return counts;
    }
}
