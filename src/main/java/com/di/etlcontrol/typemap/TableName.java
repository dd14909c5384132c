package com.di.etlcontrol.typemap;

import com.di.etlcontrol.util.InputValidator;
import lombok.Value;

/**
 * Relation name, optionally schema-qualified. Parts are kept as written and only ever reach SQL
 * delimited.
 */
@Value
public class TableName {

    /** {@code null} for an unqualified name. */
    String schema;
    String table;

    public TableName(String schema, String table) {
        this.schema = schema != null ? InputValidator.validateIdentifier(schema, "Schema name") : null;
        this.table = InputValidator.validateIdentifier(table, "Table name");
    }

    /**
     * Parses {@code schema.table} or {@code table}. Surrounding whitespace is dropped; the schema
     * ends at the first dot.
     *
     * @throws IllegalArgumentException if either part is blank or not a valid identifier
     */
    public static TableName parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        String trimmed = name.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return new TableName(null, trimmed);
        }
        return new TableName(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    /** {@code schema.table} as written, for logs, patterns and design names. */
    public String getIdentifier() {
        return schema != null ? schema + "." + table : table;
    }

    /** {@code "schema"."table"} for use in SQL. */
    public String toQuotedSql() {
        String quotedTable = TypeResolver.quoteIdentifier(table);
        return schema != null ? TypeResolver.quoteIdentifier(schema) + "." + quotedTable : quotedTable;
    }

    @Override
    public String toString() {
        return getIdentifier();
    }
}
