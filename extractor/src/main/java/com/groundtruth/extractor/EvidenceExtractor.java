package com.groundtruth.extractor;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import com.groundtruth.core.ExtractionRequest;
import com.groundtruth.core.RecordNormalizer;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.detect.Detector;
import com.groundtruth.extractor.detect.DetectorSet;
import com.groundtruth.extractor.detect.RelationalDetector;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.SchemaIntrospector;
import com.groundtruth.extractor.introspect.SchemaSnapshot;
import com.groundtruth.extractor.introspect.TableInfo;
import com.groundtruth.extractor.scan.RowStreamer;
import com.groundtruth.extractor.scan.TableScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Extracts provenance-tagged evidence from one SQLite database.
 *
 * Tables are visited in name order and, within a table, the identifier, temporal and
 * relational passes run in that order, so an unchanged database always yields the same
 * record list. A table that fails in any pass contributes nothing. Instances hold no
 * per-run state and may be reused across databases.
 */
public class EvidenceExtractor {
    private static final Logger logger = LoggerFactory.getLogger(EvidenceExtractor.class);

    private final SchemaIntrospector introspector;
    private final DetectorSet detectors;
    private final RelationalDetector relationalDetector;
    private final Function<Connection, RowStreamer> streamers;

    public EvidenceExtractor(DetectionConfig config) {
        this(new SchemaIntrospector(config), DetectorSet.standard(config),
                new RelationalDetector(config), RowStreamer::new);
    }

    EvidenceExtractor(SchemaIntrospector introspector,
                      DetectorSet detectors,
                      RelationalDetector relationalDetector,
                      Function<Connection, RowStreamer> streamers) {
        this.introspector = introspector;
        this.detectors = detectors;
        this.relationalDetector = relationalDetector;
        this.streamers = streamers;
    }

    public ExtractionResult extract(Path database, ExtractionRequest request) throws DatabaseOpenException {
        logger.info("Extracting {} from {}", request.entityClasses(), database);
        try (Connection conn = SqliteDatabases.openReadOnly(database)) {
            return extract(conn, database.toString(), request);
        } catch (SQLException e) {
            throw new DatabaseOpenException(database, "Cannot read " + database + ": " + e.getMessage(), e);
        }
    }

    /**
     * Runs over an already open connection, which stays open and owned by the caller.
     *
     * @throws SQLException if the table list itself cannot be read
     */
    public ExtractionResult extract(Connection conn, String label, ExtractionRequest request) throws SQLException {
        SchemaSnapshot schema = introspector.introspect(conn);
        RowStreamer streamer = streamers.apply(conn);

        List<EvidenceRecord> records = new ArrayList<>();
        List<SkippedTable> skipped = new ArrayList<>(schema.skippedTables());

        for (TableInfo table : schema.tables()) {
            try {
                records.addAll(extractTable(table, streamer, request));
            } catch (TableScanException e) {
                logger.warn("Skipping table {}: {}", table.name(), e.getMessage());
                skipped.add(new SkippedTable(table.name(), e.getMessage()));
            } catch (RuntimeException e) {
                logger.warn("Skipping table {} after unexpected error", table.name(), e);
                skipped.add(new SkippedTable(table.name(), "unexpected error: " + e));
            }
        }

        ExtractionResult result = new ExtractionResult(label, RecordNormalizer.deduplicate(records), skipped);
        logger.info("Extracted {} records from {} ({}), {} tables skipped",
                result.records().size(), label, result.counts(), skipped.size());
        return result;
    }

    private List<EvidenceRecord> extractTable(TableInfo table, RowStreamer streamer, ExtractionRequest request) {
        Integer limit = request.scanLimit();
        List<EvidenceRecord> records = new ArrayList<>();
        if (request.includes(EntityClass.IDENTIFIER)) {
            records.addAll(cellPass(table, streamer, detectors.forClass(EntityClass.IDENTIFIER), limit));
        }
        if (request.includes(EntityClass.TEMPORAL)) {
            records.addAll(cellPass(table, streamer, detectors.forClass(EntityClass.TEMPORAL), limit));
        }
        if (request.includes(EntityClass.RELATIONAL)) {
            records.addAll(RecordNormalizer.deduplicate(relationalDetector.detect(table, streamer, limit)));
        }
        return records;
    }

    /**
     * Streams each column that at least one detector applies to, once, and offers every
     * cell to those detectors in order.
     */
    private List<EvidenceRecord> cellPass(TableInfo table, RowStreamer streamer, List<Detector> family, Integer limit) {
        List<EvidenceRecord> records = new ArrayList<>();
        for (ColumnInfo column : table.columns()) {
            List<Detector> applicable = family.stream().filter(d -> d.appliesTo(column)).toList();
            if (applicable.isEmpty()) {
                continue;
            }
            streamer.forEachCell(table, column, limit, cell -> {
                for (Detector detector : applicable) {
                    records.addAll(detector.detect(table.name(), column, cell));
                }
            });
        }
        return RecordNormalizer.deduplicate(records);
    }
}
