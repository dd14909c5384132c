package com.di.etlcontrol.typemap;

import lombok.RequiredArgsConstructor;

/**
 * Decides, for every source column, the warehouse column type, the SELECT expression producing
 * it, and the staging serialization format.
 *
 * <p>Resolution is a pure function of the rule table and its inputs; instances are safe to share
 * between worker threads.
 */
@RequiredArgsConstructor
public class TypeResolver {

    private final TypeRuleTable ruleTable;

    /**
     * Resolves a column. Never fails for a loaded table: a type that matches no rule, including a
     * {@code null} type, gets the default mapping.
     *
     * @param sourceType source type string, e.g. {@code numeric(18,4)} or {@code integer[]}
     * @param columnName unquoted column name
     * @throws IllegalArgumentException if the column name is blank
     */
    public ResolvedMapping resolve(String sourceType, String columnName) {
        String columnReference = quoteIdentifier(columnName);
        return ruleTable.ruleFor(sourceType).toMapping(sourceType, columnReference);
    }

    /** The rule that decides the given source type. */
    public TypeRule ruleFor(String sourceType) {
        return ruleTable.ruleFor(sourceType);
    }

    /** Delimits an identifier with double quotes, doubling any embedded quote. */
    public static String quoteIdentifier(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return '"' + name.replace("\"", "\"\"") + '"';
    }
}
