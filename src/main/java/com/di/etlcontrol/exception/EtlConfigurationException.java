package com.di.etlcontrol.exception;

/**
 * Error in the ETL settings: a malformed type map, a missing retry section, an unreadable
 * settings file. Raised while loading; the pipeline must not start.
 *
 * <p>Caught by {@link GlobalExceptionHandler} and returned as a 500 with category
 * {@link ErrorCategory#CONFIGURATION_ERROR}.
 */
public class EtlConfigurationException extends EtlException {

    public EtlConfigurationException(String message) {
        super(message);
    }

    public EtlConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
