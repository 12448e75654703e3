package com.groundtruth.extractor.scan;

import com.groundtruth.extractor.SqliteFixtures;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.identity.PrimaryKeySpec;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.SchemaIntrospector;
import com.groundtruth.extractor.introspect.TableInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RowStreamerTest {

    @TempDir
    Path dir;

    private Connection conn;
    private RowStreamer streamer;

    @BeforeEach
    void setUp() throws Exception {
        Path db = SqliteFixtures.create(dir, "scan.db",
                "CREATE TABLE notes (id INTEGER PRIMARY KEY, body TEXT, ref TEXT)",
                "INSERT INTO notes VALUES (1, 'one', 'a')",
                "INSERT INTO notes VALUES (2, NULL, 'b')",
                "INSERT INTO notes VALUES (3, 'three', NULL)",
                "INSERT INTO notes VALUES (4, 'four', 'd')",
                "CREATE TABLE pairs (k1 INTEGER, k2 TEXT, v TEXT, PRIMARY KEY (k1, k2))",
                "INSERT INTO pairs VALUES (1, 'x', 'same')",
                "INSERT INTO pairs VALUES (1, 'y', 'same')");
        conn = SqliteFixtures.open(db);
        streamer = new RowStreamer(conn);
    }

    @AfterEach
    void tearDown() throws Exception {
        conn.close();
    }

    private TableInfo table(String name) throws Exception {
        return new SchemaIntrospector(DetectionConfig.defaults()).introspect(conn).tables().stream()
                .filter(t -> t.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private static ColumnInfo column(TableInfo table, String name) {
        return table.columns().stream().filter(c -> c.columnName().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void nullValuesAreNeverVisited() throws Exception {
        TableInfo notes = table("notes");
        List<Cell> cells = new ArrayList<>();

        streamer.forEachCell(notes, column(notes, "body"), null, cells::add);

        assertEquals(List.of("1", "3", "4"), cells.stream().map(Cell::rowId).toList());
        assertEquals(List.of("one", "three", "four"), cells.stream().map(Cell::text).toList());
        assertTrue(cells.stream().allMatch(c -> c.column().equals("body")));
    }

    @Test
    void limitBelowNonNullCountCapsTheScan() throws Exception {
        TableInfo notes = table("notes");
        List<Cell> cells = new ArrayList<>();

        streamer.forEachCell(notes, column(notes, "body"), 2, cells::add);

        assertEquals(2, cells.size());
    }

    @Test
    void limitAboveNonNullCountVisitsEverything() throws Exception {
        TableInfo notes = table("notes");
        List<Cell> atCount = new ArrayList<>();
        List<Cell> above = new ArrayList<>();

        streamer.forEachCell(notes, column(notes, "body"), 3, atCount::add);
        streamer.forEachCell(notes, column(notes, "body"), 100, above::add);

        assertEquals(3, atCount.size());
        assertEquals(3, above.size());
    }

    @Test
    void compositeKeysGiveDistinctIdentities() throws Exception {
        TableInfo pairs = table("pairs");
        List<Cell> cells = new ArrayList<>();

        streamer.forEachCell(pairs, column(pairs, "v"), null, cells::add);

        assertEquals(List.of("1|x", "1|y"), cells.stream().map(Cell::rowId).sorted().toList());
    }

    @Test
    void pairsRequireBothValues() throws Exception {
        TableInfo notes = table("notes");
        List<CellPair> rows = new ArrayList<>();

        streamer.forEachPair(notes, "body", "ref", null, rows::add);

        assertEquals(List.of("1", "4"), rows.stream().map(CellPair::rowId).toList());
        assertEquals("four", rows.get(1).firstText());
        assertEquals("d", rows.get(1).secondText());
    }

    @Test
    void unreadableColumnFailsTheTable() throws Exception {
        TableInfo notes = table("notes");
        // unquoted, so SQLite cannot fall back to reading it as a string literal
        TableInfo broken = new TableInfo(notes.name(), notes.columns(), new PrimaryKeySpec.RowIdentityFallback("no_such"));

        TableScanException e = assertThrows(TableScanException.class,
                () -> streamer.forEachCell(broken, column(notes, "body"), null, cell -> {}));
        assertEquals("notes", e.getTable());
    }

    @Test
    void rowsWithNullIdentityAreLeftOut() throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE legacy (k TEXT PRIMARY KEY, v TEXT)");
            stmt.execute("INSERT INTO legacy VALUES (NULL, 'orphan'), ('x', 'kept')");
            stmt.execute("CREATE TABLE links (a TEXT, b INTEGER, v TEXT, w TEXT, PRIMARY KEY (a, b))");
            stmt.execute("INSERT INTO links VALUES ('p', NULL, 'orphan', 'w1'), ('q', 2, 'kept', 'w2')");
        }
        TableInfo legacy = table("legacy");
        TableInfo links = table("links");
        List<Cell> singles = new ArrayList<>();
        List<Cell> composites = new ArrayList<>();
        List<CellPair> pairs = new ArrayList<>();

        streamer.forEachCell(legacy, column(legacy, "v"), null, singles::add);
        streamer.forEachCell(links, column(links, "v"), null, composites::add);
        streamer.forEachPair(links, "v", "w", null, pairs::add);

        assertEquals(List.of("x"), singles.stream().map(Cell::rowId).toList());
        assertEquals(List.of("q|2"), composites.stream().map(Cell::rowId).toList());
        assertEquals(List.of("q|2"), pairs.stream().map(CellPair::rowId).toList());
    }

    @Test
    void realValuesKeepTheirStoredText() throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE readings (id INTEGER PRIMARY KEY, taken REAL, peer REAL)");
            stmt.execute("INSERT INTO readings VALUES (1, 1700000000.5, 10000000.0)");
        }
        TableInfo readings = table("readings");
        List<Cell> cells = new ArrayList<>();
        List<CellPair> pairs = new ArrayList<>();

        streamer.forEachCell(readings, column(readings, "taken"), null, cells::add);
        streamer.forEachPair(readings, "taken", "peer", null, pairs::add);

        assertEquals("1700000000.5", cells.get(0).text());
        assertEquals("1700000000.5", pairs.get(0).firstText());
        assertEquals("10000000.0", pairs.get(0).secondText());
    }

    @Test
    void blobsDecodeAsText() {
        Cell cell = new Cell("1", "data", "hello".getBytes());

        assertEquals("hello", cell.text());
        assertEquals("42", new Cell("1", "n", 42).text());
    }
}
