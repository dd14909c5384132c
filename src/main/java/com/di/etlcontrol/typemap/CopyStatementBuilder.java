package com.di.etlcontrol.typemap;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembles the {@code COPY ... TO STDOUT} statement that extracts a table with every column
 * already converted to its warehouse type.
 */
public final class CopyStatementBuilder {

    /** COPY options for the CSV staging format. */
    public static final String CSV_WRITE_FORMAT = "FORMAT csv, HEADER true, NULL '\\N'";

    private CopyStatementBuilder() {}

    public static String build(String tableName, List<ColumnDefinition> columns, Integer rowLimit) {
        return build(TableName.parse(tableName), columns, rowLimit);
    }

    /**
     * @param tableName source table; schema and table are quoted in the FROM clause
     * @param columns   column definitions from {@link TableDesignMapper}
     * @param rowLimit  optional row limit; {@code null} or non-positive means all rows
     */
    public static String build(TableName tableName, List<ColumnDefinition> columns, Integer rowLimit) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a COPY statement without columns");
        }
        String selectList = columns.stream()
                .map(CopyStatementBuilder::selectItem)
                .collect(Collectors.joining(",\n       "));
        String limit = (rowLimit != null && rowLimit > 0) ? "\n LIMIT " + rowLimit : "";
        return "COPY (SELECT " + selectList + "\n  FROM " + tableName.toQuotedSql() + limit
                + ") TO STDOUT WITH (" + CSV_WRITE_FORMAT + ")";
    }

    private static String selectItem(ColumnDefinition column) {
        String quoted = TypeResolver.quoteIdentifier(column.getName());
        return column.getExpression() != null ? column.getExpression() + " AS " + quoted : quoted;
    }
}
