package com.di.etlcontrol.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InputValidator.
 */
@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // SQL Identifier Tests
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"orders", "_tmp", "Order Date", "größe", "unit-price", "a\"b", "drop;table", " padded "})
    @DisplayName("Should accept any identifier that can be quoted, unchanged")
    void testValidateIdentifier_Valid(String identifier) {
        assertEquals(identifier, InputValidator.validateIdentifier(identifier, "Column name"));
    }

    @Test
    @DisplayName("Should reject null, blank and NUL-containing identifiers")
    void testValidateIdentifier_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateIdentifier(null, "Column name"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateIdentifier("  ", "Column name"));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateColumnName("a\0b"));
        assertTrue(ex.getMessage().contains("NUL"));
    }

    @Test
    @DisplayName("Should limit identifiers to 63 bytes, not characters")
    void testValidateIdentifier_ByteLength() {
        assertEquals(63, InputValidator.validateIdentifier("a".repeat(63), "Column name").length());
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateIdentifier("a".repeat(64), "Column name"));
        assertEquals(31, InputValidator.validateIdentifier("ö".repeat(31), "Column name").length());
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateIdentifier("ö".repeat(32), "Column name"));
    }

    // ============================================================================
    // Monitor Name Tests
    // ============================================================================

    @Test
    @DisplayName("Should accept free-form monitor names")
    void testValidateMonitorName_Valid() {
        assertEquals("public.orders (part 1)", InputValidator.validateMonitorName(" public.orders (part 1) ", "Target"));
    }

    @Test
    @DisplayName("Should reject blank, long or control-character monitor names")
    void testValidateMonitorName_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateMonitorName(null, "Target"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateMonitorName(" ", "Target"));
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateMonitorName("x".repeat(257), "Target"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateMonitorName("a\nb", "Target"));
    }
}
