package com.groundtruth.extractor.scan;

import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.SqliteQueries;
import com.groundtruth.extractor.introspect.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.Consumer;

/**
 * Streams non-null cells of one table over a connection it does not own.
 *
 * A failing query raises {@link TableScanException}; a row whose identity is NULL is
 * left out and counted, never given a substitute identity.
 */
public class RowStreamer {
    private static final Logger logger = LoggerFactory.getLogger(RowStreamer.class);

    private final Connection connection;

    public RowStreamer(Connection connection) {
        this.connection = connection;
    }

    /**
     * Visits up to {@code limit} non-null values of a column, or all of them when the limit is null.
     */
    public void forEachCell(TableInfo table, ColumnInfo column, Integer limit, Consumer<Cell> visitor) {
        String sql = SqliteQueries.cells(table.name(), table.identity().expression(), column.columnName(), limit);
        int nullIdentities = 0;
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                String rowId = rs.getString(SqliteQueries.ROW_ID_COLUMN);
                if (rowId == null) {
                    nullIdentities++;
                    continue;
                }
                Object value = rs.getObject(SqliteQueries.VALUE_COLUMN);
                if (value != null) {
                    visitor.accept(new Cell(rowId, column.columnName(), value,
                            text(rs, SqliteQueries.VALUE_COLUMN, value)));
                }
            }
        } catch (SQLException e) {
            throw new TableScanException(table.name(),
                    "failed to read column " + column.columnName() + ": " + e.getMessage(), e);
        }
        warnNullIdentities(table, nullIdentities);
    }

    /**
     * Visits rows where both columns are non-null, up to {@code limit} rows when one is given.
     */
    public void forEachPair(TableInfo table, String first, String second, Integer limit, Consumer<CellPair> visitor) {
        String sql = SqliteQueries.pairs(table.name(), table.identity().expression(), first, second, limit);
        int nullIdentities = 0;
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                String rowId = rs.getString(SqliteQueries.ROW_ID_COLUMN);
                if (rowId == null) {
                    nullIdentities++;
                    continue;
                }
                Object firstValue = rs.getObject(SqliteQueries.VALUE_COLUMN);
                Object secondValue = rs.getObject(SqliteQueries.SECOND_VALUE_COLUMN);
                visitor.accept(new CellPair(rowId, firstValue, secondValue,
                        text(rs, SqliteQueries.VALUE_COLUMN, firstValue),
                        text(rs, SqliteQueries.SECOND_VALUE_COLUMN, secondValue)));
            }
        } catch (SQLException e) {
            throw new TableScanException(table.name(),
                    "failed to read columns " + first + "," + second + ": " + e.getMessage(), e);
        }
        warnNullIdentities(table, nullIdentities);
    }

    // blobs are decoded as UTF-8; everything else uses SQLite's own text conversion
    private static String text(ResultSet rs, String column, Object value) throws SQLException {
        if (value instanceof byte[]) {
            return Cell.asText(value);
        }
        return rs.getString(column);
    }

    private static void warnNullIdentities(TableInfo table, int count) {
        if (count > 0) {
            logger.warn("Skipped {} rows of {} whose {} identity is NULL",
                    count, table.name(), table.identity().kind());
        }
    }
}
