package com.groundtruth.extractor;

import java.nio.file.Path;

/**
 * A database could not be opened or its schema could not be listed: missing, corrupt,
 * encrypted, or not SQLite at all. Aborts the run for that database only.
 */
public class DatabaseOpenException extends Exception {
    private final Path database;

    public DatabaseOpenException(Path database, String message) {
        super(message);
        this.database = database;
    }

    public DatabaseOpenException(Path database, String message, Throwable cause) {
        super(message, cause);
        this.database = database;
    }

    public Path getDatabase() {
        return database;
    }
}
