package com.di.etlcontrol.util;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Input validation for identifiers that end up (quoted) in generated SQL and for the free-form
 * names reported to the monitor.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // SQL Identifier Validation
    // ============================================================================

    /** PostgreSQL truncates identifiers longer than NAMEDATALEN - 1 bytes. */
    private static final int MAX_IDENTIFIER_BYTES = 63;

    /** Relation and step names reported to the monitor are free-form but bounded. */
    private static final int MAX_MONITOR_NAME_LENGTH = 256;

    /**
     * Validates a PostgreSQL identifier (schema, table or column name) that is always written
     * delimited ({@code "name"}, embedded quotes doubled). Any character is allowed except NUL,
     * which PostgreSQL cannot store.
     *
     * @param identifier     The identifier to validate
     * @param identifierType Type of identifier for error messages (e.g., "Table name", "Column name")
     * @return The identifier, unchanged
     * @throws IllegalArgumentException if the identifier is null, blank, contains NUL or exceeds 63 bytes
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        if (identifier.isBlank()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (identifier.indexOf('\0') >= 0) {
            log.warn("NUL character in {}: {}", identifierType, identifier.replace('\0', '?'));
            throw new IllegalArgumentException(String.format("%s contains a NUL character", identifierType));
        }
        int bytes = identifier.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > MAX_IDENTIFIER_BYTES) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d bytes (%d): %s",
                            identifierType, MAX_IDENTIFIER_BYTES, bytes, identifier));
        }
        return identifier;
    }

    public static String validateColumnName(String columnName) {
        return validateIdentifier(columnName, "Column name");
    }

    // ============================================================================
    // Monitor Name Validation
    // ============================================================================

    /**
     * Validates a relation, target or step name reported to the monitor.
     *
     * @param name     The name to validate
     * @param nameType Type of name for error messages (e.g., "relation name", "step")
     * @return The trimmed name
     * @throws IllegalArgumentException if the name is null, blank, too long or has control characters
     */
    public static String validateMonitorName(String name, String nameType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(String.format("%s cannot be null or empty", nameType));
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_MONITOR_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters", nameType, MAX_MONITOR_NAME_LENGTH));
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (Character.isISOControl(trimmed.charAt(i))) {
                throw new IllegalArgumentException(String.format("%s contains control characters", nameType));
            }
        }
        return trimmed;
    }
}
