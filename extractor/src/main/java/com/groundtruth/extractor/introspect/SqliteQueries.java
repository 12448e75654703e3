package com.groundtruth.extractor.introspect;

/**
 * SQL used to read a SQLite database. Every statement is read-only.
 *
 * Identifiers are always double-quoted with embedded quotes doubled, since forensic
 * schemas routinely use reserved words and odd characters as table and column names.
 */
public final class SqliteQueries {
    private SqliteQueries() {}

    public static final String TABLES = """
            SELECT name
            FROM sqlite_master
            WHERE type = 'table'
              AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\'
            ORDER BY name
            """;

    public static final String ROW_ID_COLUMN = "__rid__";
    public static final String VALUE_COLUMN = "__val__";
    public static final String SECOND_VALUE_COLUMN = "__val2__";

    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String tableInfo(String table) {
        return "PRAGMA table_info(" + quote(table) + ")";
    }

    public static String checkRowIdentity(String table, String expression) {
        return "SELECT " + expression + " FROM " + quote(table) + " LIMIT 1";
    }

    public static String cells(String table, String identityExpression, String column, Integer limit) {
        String col = quote(column);
        return "SELECT " + identityExpression + " AS " + ROW_ID_COLUMN + ", " + col + " AS " + VALUE_COLUMN
                + " FROM " + quote(table)
                + " WHERE " + col + " IS NOT NULL"
                + limitClause(limit);
    }

    public static String pairs(String table, String identityExpression, String first, String second, Integer limit) {
        String a = quote(first);
        String b = quote(second);
        return "SELECT " + identityExpression + " AS " + ROW_ID_COLUMN
                + ", " + a + " AS " + VALUE_COLUMN
                + ", " + b + " AS " + SECOND_VALUE_COLUMN
                + " FROM " + quote(table)
                + " WHERE " + a + " IS NOT NULL AND " + b + " IS NOT NULL"
                + limitClause(limit);
    }

    private static String limitClause(Integer limit) {
        return limit == null ? "" : " LIMIT " + limit.intValue();
    }
}
