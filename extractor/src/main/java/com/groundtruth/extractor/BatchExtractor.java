package com.groundtruth.extractor;

import com.groundtruth.core.ExtractionRequest;
import com.groundtruth.core.io.RecordFormat;
import com.groundtruth.core.io.RecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the extractor over many databases one after another. Each database gets its own
 * connection; a database that cannot be opened or written is recorded as a failure and
 * the batch moves on.
 */
public class BatchExtractor {
    private static final Logger logger = LoggerFactory.getLogger(BatchExtractor.class);

    private final EvidenceExtractor extractor;
    private final RecordWriter writer;

    public BatchExtractor(EvidenceExtractor extractor, RecordWriter writer) {
        this.extractor = extractor;
        this.writer = writer;
    }

    public BatchResult run(Path root, List<Path> databases, Path outputDir,
                           RecordFormat format, ExtractionRequest request) {
        List<DatabaseOutcome> outcomes = new ArrayList<>();
        for (Path database : databases) {
            Path output = outputDir.resolve(DatabaseFinder.outputName(root, database, format));
            try {
                ExtractionResult result = extractor.extract(database, request);
                writer.write(result.records(), output, format);
                outcomes.add(DatabaseOutcome.success(database, output, result));
            } catch (DatabaseOpenException e) {
                logger.error("Failed to extract {}: {}", database, e.getMessage());
                outcomes.add(DatabaseOutcome.failure(database, e.getMessage()));
            } catch (IOException e) {
                logger.error("Failed to write {}: {}", output, e.getMessage());
                outcomes.add(DatabaseOutcome.failure(database, "cannot write " + output + ": " + e.getMessage()));
            } catch (RuntimeException e) {
                logger.error("Failed to extract {}", database, e);
                outcomes.add(DatabaseOutcome.failure(database, "unexpected error: " + e));
            }
        }
        BatchResult result = new BatchResult(outcomes);
        logger.info("Batch complete: {} succeeded, {} failed", result.successes(), result.failures());
        return result;
    }
}
