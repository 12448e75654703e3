package com.groundtruth.extractor;

import java.nio.file.Path;

/**
 * What happened to one database of a batch: a result and where it was written, or the
 * reason it failed.
 */
public record DatabaseOutcome(Path database, Path output, ExtractionResult result, String error) {

    public static DatabaseOutcome success(Path database, Path output, ExtractionResult result) {
        return new DatabaseOutcome(database, output, result, null);
    }

    public static DatabaseOutcome failure(Path database, String error) {
        return new DatabaseOutcome(database, null, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
