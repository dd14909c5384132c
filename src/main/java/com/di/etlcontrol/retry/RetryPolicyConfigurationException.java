package com.di.etlcontrol.retry;

import com.di.etlcontrol.exception.EtlConfigurationException;

/**
 * Thrown when the {@code retry} settings section is missing, incomplete or negative.
 */
public class RetryPolicyConfigurationException extends EtlConfigurationException {

    public RetryPolicyConfigurationException(String message) {
        super(message);
    }
}
