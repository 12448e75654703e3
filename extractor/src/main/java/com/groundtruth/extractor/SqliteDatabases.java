package com.groundtruth.extractor;

import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens evidence databases read-only. Nothing is ever written to the source file.
 */
public final class SqliteDatabases {
    private SqliteDatabases() {}

    public static Connection openReadOnly(Path database) throws DatabaseOpenException {
        if (!Files.isRegularFile(database)) {
            throw new DatabaseOpenException(database, "Database file not found: " + database);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + database.toAbsolutePath());
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new DatabaseOpenException(database, "Cannot open " + database + ": " + e.getMessage(), e);
        }
    }
}
