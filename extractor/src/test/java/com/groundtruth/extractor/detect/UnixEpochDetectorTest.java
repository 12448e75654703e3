package com.groundtruth.extractor.detect;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.scan.Cell;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.groundtruth.extractor.detect.DetectorFixtures.CONFIG;
import static com.groundtruth.extractor.detect.DetectorFixtures.column;
import static org.junit.jupiter.api.Assertions.*;

class UnixEpochDetectorTest {

    private final UnixEpochDetector detector = new UnixEpochDetector(CONFIG);

    @Test
    void secondsAndMillisecondsGiveTheSameInstant() {
        Instant expected = Instant.parse("2023-11-14T22:13:20Z");

        assertEquals(Optional.of(expected), detector.fromEpoch(1_700_000_000L));
        assertEquals(Optional.of(expected), detector.fromEpoch(1_700_000_000_000L));
    }

    @Test
    void windowIsExclusive() {
        assertEquals(Optional.empty(), detector.fromEpoch(946_684_800L));
        assertEquals(Optional.empty(), detector.fromEpoch(1_893_456_000L));
        assertTrue(detector.fromEpoch(946_684_801L).isPresent());
        assertEquals(Optional.empty(), detector.fromEpoch(42L));
        assertEquals(Optional.empty(), detector.fromEpoch(-1_700_000_000L));
    }

    @Test
    void numericTextAndRealsAreAccepted() {
        Instant expected = Instant.parse("2023-11-14T22:13:20Z");

        assertEquals(Optional.of(expected), detector.toInstant((Object) " 1700000000 "));
        assertEquals(Optional.of(expected), detector.toInstant((Object) 1_700_000_000.75d));
        assertEquals(Optional.empty(), detector.toInstant((Object) "yesterday"));
        assertEquals(Optional.empty(), detector.toInstant((Object) Double.NaN));
    }

    @Test
    void recordKeepsTheRawValue() {
        List<EvidenceRecord> records = detector.detect("messages", column("sent_at", "INTEGER"),
                new Cell("1", "sent_at", 1_700_000_000L));

        assertEquals(1, records.size());
        EvidenceRecord record = records.get(0);
        assertEquals(EntityClass.TEMPORAL, record.entityType());
        assertEquals("UnixEpoch", record.subtype());
        assertEquals("2023-11-14T22:13:20Z", record.value());
        assertEquals("1700000000", record.raw());
    }

    @Test
    void boxedDriverValuesGoThroughDetect() {
        ColumnInfo sentAt = column("sent_at", "INTEGER");

        List<EvidenceRecord> fromLong = detector.detect("t", sentAt,
                new Cell("1", "sent_at", Long.valueOf(1_700_000_000_000L)));
        List<EvidenceRecord> fromInteger = detector.detect("t", sentAt,
                new Cell("2", "sent_at", Integer.valueOf(1_700_000_000)));
        List<EvidenceRecord> fromDouble = detector.detect("t", column("taken", "REAL"),
                new Cell("3", "taken", 1_700_000_000.5d, "1700000000.5"));

        assertEquals("2023-11-14T22:13:20Z", fromLong.get(0).value());
        assertEquals("1700000000000", fromLong.get(0).raw());
        assertEquals("2023-11-14T22:13:20Z", fromInteger.get(0).value());
        assertEquals("2023-11-14T22:13:20Z", fromDouble.get(0).value());
        assertEquals("1700000000.5", fromDouble.get(0).raw());
        assertTrue(detector.detect("t", sentAt, new Cell("4", "sent_at", Long.valueOf(42L))).isEmpty());
    }

    @Test
    void appliesToNumericOrTimeNamedColumns() {
        assertTrue(detector.appliesTo(column("count", "INTEGER")));
        assertTrue(detector.appliesTo(column("duration", "REAL")));
        assertTrue(detector.appliesTo(column("created", "TEXT")));
        assertFalse(detector.appliesTo(column("body", "TEXT")));
    }
}
