package com.groundtruth.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes records that repeat an earlier record's full key, keeping first-seen order.
 */
public final class RecordNormalizer {
    private RecordNormalizer() {}

    public static List<EvidenceRecord> deduplicate(List<EvidenceRecord> records) {
        Set<EvidenceRecord.Key> seen = new HashSet<>();
        List<EvidenceRecord> result = new ArrayList<>(records.size());
        for (EvidenceRecord record : records) {
            if (seen.add(record.key())) {
                result.add(record);
            }
        }
        return result;
    }
}
