package com.groundtruth.extractor.identity;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.groundtruth.extractor.introspect.SqliteQueries;

import java.util.List;
import java.util.stream.Collectors;

/**
 * How a table's rows are identified. {@link #expression()} is a SQL expression that yields
 * the row identity when selected from the table.
 */
public interface PrimaryKeySpec {

    String COMPOSITE_SEPARATOR = "|";

    @JsonProperty("kind")
    String kind();

    @JsonProperty("expression")
    String expression();

    record SingleColumn(@JsonProperty("column") String column) implements PrimaryKeySpec {
        @Override
        public String kind() {
            return "pk";
        }

        @Override
        public String expression() {
            return SqliteQueries.quote(column);
        }
    }

    /**
     * Key members cast to text and joined with {@value #COMPOSITE_SEPARATOR}. Two keys collide
     * only if their member values themselves contain the separator.
     */
    record CompositeColumns(@JsonProperty("columns") List<String> columns) implements PrimaryKeySpec {
        public CompositeColumns {
            columns = List.copyOf(columns);
        }

        @Override
        public String kind() {
            return "composite_pk";
        }

        @Override
        public String expression() {
            return columns.stream()
                    .map(c -> "CAST(" + SqliteQueries.quote(c) + " AS TEXT)")
                    .collect(Collectors.joining(" || '" + COMPOSITE_SEPARATOR + "' || "));
        }
    }

    /**
     * SQLite's implicit row id, under whichever alias is not shadowed by a user column.
     */
    record RowIdentityFallback(@JsonProperty("alias") String alias) implements PrimaryKeySpec {
        @Override
        public String kind() {
            return "rowid";
        }

        @Override
        public String expression() {
            return alias;
        }
    }
}
