package com.di.etlcontrol.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for error responses and log lines.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and optionally add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "ETL settings or type map configuration issue"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. Configuration errors are checked before validation errors. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers (add new ones here when adding categories) ---

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof EtlConfigurationException
                || t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof org.springframework.web.bind.MethodArgumentNotValidException
                || t instanceof org.springframework.web.bind.MissingServletRequestParameterException
                || t instanceof org.springframework.web.method.annotation.MethodArgumentTypeMismatchException
                || t instanceof jakarta.validation.ConstraintViolationException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof org.springframework.http.converter.HttpMessageNotReadableException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.FileSystemException;
    }

    @Override
    public String toString() {
        return name();
    }
}
