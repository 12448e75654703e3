package com.groundtruth.extractor.identity;

import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.SqliteQueries;
import com.groundtruth.extractor.scan.TableScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the row identity for a table: its declared primary key when there is one,
 * otherwise SQLite's implicit row id. A table with neither is rejected rather than
 * given a guessed identity.
 */
public class RowIdentityResolver {
    private static final Logger logger = LoggerFactory.getLogger(RowIdentityResolver.class);

    static final List<String> ROW_ID_ALIASES = List.of("rowid", "_rowid_", "oid");

    public PrimaryKeySpec resolve(Connection connection, String table, List<ColumnInfo> columns) {
        Optional<PrimaryKeySpec> declared = fromPrimaryKey(columns);
        if (declared.isPresent()) {
            return declared.get();
        }

        String alias = unshadowedAlias(columns).orElseThrow(() -> new TableScanException(table,
                "no primary key and every row id alias is shadowed by a column"));

        PrimaryKeySpec fallback = new PrimaryKeySpec.RowIdentityFallback(alias);
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(SqliteQueries.checkRowIdentity(table, fallback.expression()))) {
            rs.next();
        } catch (SQLException e) {
            throw new TableScanException(table, "no primary key and no implicit row id: " + e.getMessage(), e);
        }
        logger.debug("Table {} has no primary key, using {}", table, alias);
        return fallback;
    }

    /**
     * Identity from declared primary-key members, ordered by their position in the key.
     */
    public static Optional<PrimaryKeySpec> fromPrimaryKey(List<ColumnInfo> columns) {
        List<String> keyColumns = columns.stream()
                .filter(c -> c.primaryKeyPosition() > 0)
                .sorted(Comparator.comparingInt(ColumnInfo::primaryKeyPosition))
                .map(ColumnInfo::columnName)
                .toList();

        if (keyColumns.isEmpty()) {
            return Optional.empty();
        }
        if (keyColumns.size() == 1) {
            return Optional.of(new PrimaryKeySpec.SingleColumn(keyColumns.get(0)));
        }
        return Optional.of(new PrimaryKeySpec.CompositeColumns(keyColumns));
    }

    static Optional<String> unshadowedAlias(List<ColumnInfo> columns) {
        return ROW_ID_ALIASES.stream()
                .filter(alias -> columns.stream().noneMatch(c -> c.columnName().equalsIgnoreCase(alias)))
                .findFirst();
    }
}
