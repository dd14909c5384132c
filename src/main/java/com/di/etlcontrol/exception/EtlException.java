package com.di.etlcontrol.exception;

/**
 * Parent of all ETL-oriented exceptions so callers can catch the whole family in one place.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
