package com.groundtruth.extractor.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groundtruth.extractor.GroundTruthCli;
import com.groundtruth.extractor.SqliteFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GroundTruthCliTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path db;

    @BeforeEach
    void setUp() throws Exception {
        db = SqliteFixtures.fromResource(dir, "messages.db", "/messages-init.sql");
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new GroundTruthCli());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void extractWritesGroundTruth() throws Exception {
        Path target = dir.resolve("gt.json");

        int exit = run("extract", db.toString(), "--out", target.toString());

        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().contains("Wrote 3 records to " + target));
        assertTrue(out.toString().contains("Identifier=1 Temporal=1 Relational=1"));
        JsonNode written = new ObjectMapper().readTree(target.toFile());
        assertEquals(3, written.size());
    }

    @Test
    void extractHonoursEntityFilter() throws Exception {
        Path target = dir.resolve("gt.csv");

        assertEquals(0, run("extract", db.toString(), "-o", target.toString(), "-e", "relational"));

        String csv = Files.readString(target);
        assertTrue(csv.startsWith("column,entity_type,rowid,subtype,table,value"));
        assertTrue(csv.contains("10->20"));
        assertFalse(csv.contains("a@b.com"));
    }

    @Test
    void badArgumentsAndMissingFiles() {
        assertEquals(2, run("extract", db.toString(), "-o", dir.resolve("x.json").toString(), "-e", "nonsense"));
        assertEquals(2, run("extract", db.toString(), "-o", dir.resolve("x.json").toString(), "--limit", "0"));
        assertEquals(1, run("extract", dir.resolve("missing.db").toString(), "-o", dir.resolve("y.json").toString()));
        assertTrue(err.toString().contains("not found"));
    }

    @Test
    void batchWithoutDatabasesExitsTwo() throws Exception {
        Path empty = Files.createDirectories(dir.resolve("empty"));

        assertEquals(2, run("batch", empty.toString(), "--outdir", dir.resolve("out").toString()));
        assertTrue(err.toString().contains("No SQLite databases found."));
    }

    @Test
    void batchReportsFailures() throws Exception {
        Files.writeString(dir.resolve("junk.db"), "junk ".repeat(300));
        Path outDir = dir.resolve("out");

        int exit = run("batch", dir.toString(), "--outdir", outDir.toString(), "--fmt", "csv");

        assertEquals(1, exit);
        assertTrue(out.toString().contains("Done. Success: 1, Failures: 1"));
        assertTrue(err.toString().contains("[ERROR]"));
        assertTrue(Files.exists(outDir.resolve("messages.db.ground_truth.csv")));
    }

    @Test
    void introspectPrintsSchema() throws Exception {
        assertEquals(0, run("introspect", db.toString()));

        JsonNode snapshot = new ObjectMapper().readTree(out.toString());
        JsonNode table = snapshot.get("tables").get(0);
        assertEquals("messages", table.get("name").asText());
        assertEquals("pk", table.get("identity").get("kind").asText());
    }

    @Test
    void scoreComparesFindingsWithGroundTruth() throws Exception {
        Path gold = dir.resolve("gt.json");
        assertEquals(0, run("extract", db.toString(), "-o", gold.toString()));
        Path findings = Files.writeString(dir.resolve("findings.json"), """
                {"findings": [
                  {"value": "a@b.com", "table": "messages", "rowid": "1"},
                  {"value": "z@z.com", "table": "messages", "rowid": "1"}
                ]}
                """);
        out.getBuffer().setLength(0);

        assertEquals(0, run("score", "--gold", gold.toString(), "--findings", findings.toString(),
                "--entity", "identifier"));

        JsonNode score = new ObjectMapper().readTree(out.toString());
        assertEquals(1, score.get("TP").asInt());
        assertEquals(1, score.get("FP").asInt());
        assertEquals(0, score.get("FN").asInt());
        assertEquals(0.5, score.get("precision").asDouble());
        assertEquals(1.0, score.get("recall").asDouble());
    }
}
