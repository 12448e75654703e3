package com.groundtruth.core.io;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordReaderTest {

    @TempDir
    Path dir;

    private final List<EvidenceRecord> records = List.of(
            EvidenceRecord.identifier("Phone", "+5551234567", "contacts", "number", "a|b"),
            EvidenceRecord.temporal("UnixEpoch", "2023-11-14T22:13:20Z", "1700000000", "messages", "sent_at", "7")
    );

    @Test
    void readsBackJson() throws Exception {
        Path file = dir.resolve("gt.json");
        new RecordWriter().write(records, file);

        assertEquals(records, new RecordReader().read(file));
    }

    @Test
    void readsBackCsv() throws Exception {
        Path file = dir.resolve("gt.csv");
        new RecordWriter().write(records, file);

        assertEquals(records, new RecordReader().read(file));
    }

    @Test
    void acceptsLegacyFieldNames() throws Exception {
        Path file = dir.resolve("legacy.csv");
        Files.writeString(file, """
                EntityType,Value,Table,RowID
                identifier, a@b.com ,messages,3
                geolocation,51.5,places,1
                """);

        List<EvidenceRecord> read = new RecordReader().read(file);

        assertEquals(1, read.size());
        EvidenceRecord record = read.get(0);
        assertEquals(EntityClass.IDENTIFIER, record.entityType());
        assertEquals("a@b.com", record.value());
        assertEquals("messages", record.table());
        assertEquals("3", record.rowId());
        assertNull(record.raw());
    }

    @Test
    void emptyCsvHasNoRecords() throws Exception {
        Path file = dir.resolve("empty.csv");
        Files.writeString(file, "");

        assertTrue(new RecordReader().read(file).isEmpty());
    }
}
