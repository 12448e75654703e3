package com.groundtruth.extractor.introspect;

import com.groundtruth.extractor.SkippedTable;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.identity.PrimaryKeySpec;
import com.groundtruth.extractor.identity.RowIdentityResolver;
import com.groundtruth.extractor.scan.TableScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Introspects a SQLite database: user tables from {@code sqlite_master}, columns from
 * {@code PRAGMA table_info}, and a resolved row identity per table.
 *
 * Failing to list tables means the database itself is unreadable and is thrown. A single
 * table whose metadata or identity cannot be read is reported as skipped instead.
 */
public class SchemaIntrospector {
    private static final Logger logger = LoggerFactory.getLogger(SchemaIntrospector.class);

    private final DetectionConfig config;
    private final RowIdentityResolver identityResolver;

    public SchemaIntrospector(DetectionConfig config, RowIdentityResolver identityResolver) {
        this.config = config;
        this.identityResolver = identityResolver;
    }

    public SchemaIntrospector(DetectionConfig config) {
        this(config, new RowIdentityResolver());
    }

    public SchemaSnapshot introspect(Connection conn) throws SQLException {
        List<String> names = queryTables(conn);
        List<TableInfo> tables = new ArrayList<>();
        List<SkippedTable> skipped = new ArrayList<>();

        for (String name : names) {
            try {
                List<ColumnInfo> columns = queryColumns(conn, name);
                if (columns.isEmpty()) {
                    throw new TableScanException(name, "no column metadata");
                }
                PrimaryKeySpec identity = identityResolver.resolve(conn, name, columns);
                tables.add(new TableInfo(name, columns, identity));
            } catch (SQLException e) {
                logger.warn("Skipping table {}: cannot read metadata: {}", name, e.getMessage());
                skipped.add(new SkippedTable(name, "cannot read metadata: " + e.getMessage()));
            } catch (TableScanException e) {
                logger.warn("Skipping table {}: {}", name, e.getMessage());
                skipped.add(new SkippedTable(name, e.getMessage()));
            }
        }

        logger.info("Introspection complete: {} tables, {} skipped", tables.size(), skipped.size());
        return new SchemaSnapshot(tables, skipped);
    }

    private List<String> queryTables(Connection conn) throws SQLException {
        List<String> result = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SqliteQueries.TABLES)) {
            while (rs.next()) {
                result.add(rs.getString("name"));
            }
        }
        return result;
    }

    private List<ColumnInfo> queryColumns(Connection conn, String table) throws SQLException {
        List<ColumnInfo> result = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SqliteQueries.tableInfo(table))) {
            while (rs.next()) {
                String name = rs.getString("name");
                String declaredType = rs.getString("type");
                result.add(new ColumnInfo(
                        table,
                        name,
                        declaredType == null ? "" : declaredType,
                        TypeClass.of(declaredType),
                        rs.getInt("cid"),
                        rs.getInt("pk"),
                        ColumnHints.classify(name, config)
                ));
            }
        }
        return result;
    }
}
