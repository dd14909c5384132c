package com.di.etlcontrol.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the monitoring and type-map endpoints.
 *
 * <p>Every handler categorizes the exception with {@link ErrorCategory}, logs it once with the
 * request id from MDC, and returns a structured {@link ErrorResponse}:
 * <ul>
 *   <li>configuration errors: 500, the settings must be fixed before the run can proceed</li>
 *   <li>validation errors (bad arguments, missing or mistyped parameters, unreadable or invalid
 *       bodies): 400</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EtlConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationException(EtlConfigurationException e) {
        return respond("CONFIGURATION_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        StringBuilder message = new StringBuilder();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            response.addDetail(fieldError.getField(), fieldError.getDefaultMessage());
            if (message.length() > 0) message.append("; ");
            message.append(fieldError.getField()).append(' ').append(fieldError.getDefaultMessage());
        }
        if (message.length() > 0) {
            response.setMessage(message.toString());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class,
                       HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Exception e, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(eventType, category, e);
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        if (category == ErrorCategory.VALIDATION_ERROR || category == ErrorCategory.SERIALIZATION_ERROR) {
            log.warn("[{}] {} on {}: {}", eventType, category.getName(), getRequestPath(), exception.getMessage());
        } else {
            log.error("[{}] {} on {}: {}", eventType, category.getName(), getRequestPath(),
                    exception.getMessage(), exception);
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    private String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
