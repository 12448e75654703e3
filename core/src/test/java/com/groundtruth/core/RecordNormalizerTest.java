package com.groundtruth.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordNormalizerTest {

    @Test
    void dropsExactRepeatsKeepingFirstSeenOrder() {
        EvidenceRecord a = EvidenceRecord.identifier("Email", "a@b.com", "messages", "body", "1");
        EvidenceRecord b = EvidenceRecord.identifier("Email", "c@d.com", "messages", "body", "1");

        List<EvidenceRecord> result = RecordNormalizer.deduplicate(List.of(a, b, a, b, a));

        assertEquals(List.of(a, b), result);
    }

    @Test
    void recordsDifferingInAnyKeyFieldAreKept() {
        EvidenceRecord base = EvidenceRecord.identifier("URL", "http://10.0.0.1", "t", "c", "1");
        List<EvidenceRecord> variants = List.of(
                base,
                EvidenceRecord.identifier("IPv4", "http://10.0.0.1", "t", "c", "1"),
                EvidenceRecord.identifier("URL", "http://10.0.0.2", "t", "c", "1"),
                EvidenceRecord.identifier("URL", "http://10.0.0.1", "u", "c", "1"),
                EvidenceRecord.identifier("URL", "http://10.0.0.1", "t", "d", "1"),
                EvidenceRecord.identifier("URL", "http://10.0.0.1", "t", "c", "2"),
                new EvidenceRecord(EntityClass.TEMPORAL, "URL", "http://10.0.0.1", "t", "1", "c", null)
        );

        assertEquals(variants, RecordNormalizer.deduplicate(variants));
    }

    @Test
    void rawValueIsNotPartOfTheKey() {
        EvidenceRecord seconds = EvidenceRecord.temporal("UnixEpoch", "2023-11-14T22:13:20Z", "1700000000", "t", "c", "1");
        EvidenceRecord millis = EvidenceRecord.temporal("UnixEpoch", "2023-11-14T22:13:20Z", "1700000000000", "t", "c", "1");

        List<EvidenceRecord> result = RecordNormalizer.deduplicate(List.of(seconds, millis));

        assertEquals(1, result.size());
        assertEquals("1700000000", result.get(0).raw());
    }
}
