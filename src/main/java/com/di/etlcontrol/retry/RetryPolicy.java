package com.di.etlcontrol.retry;

import com.di.etlcontrol.config.RetrySettings;
import lombok.Value;

/**
 * Per-stage retry budgets: the number of additional attempts after the first failure.
 * Zero means the stage fails on its first error.
 *
 * <p>This object only carries the budget. The stage executor counts attempts against it and
 * treats exhaustion as a fatal failure of the run.
 */
@Value
public class RetryPolicy {

    int extractRetries;
    int copyDataRetries;
    int insertDataRetries;

    public RetryPolicy(int extractRetries, int copyDataRetries, int insertDataRetries) {
        this.extractRetries = requireNonNegative("extract_retries", extractRetries);
        this.copyDataRetries = requireNonNegative("copy_data_retries", copyDataRetries);
        this.insertDataRetries = requireNonNegative("insert_data_retries", insertDataRetries);
    }

    /**
     * Builds the policy from the {@code retry} settings section. Every counter must be present:
     * an absent value is not the same as zero.
     *
     * @throws RetryPolicyConfigurationException if the section or one of its counters is missing
     *                                           or negative
     */
    public static RetryPolicy fromSettings(RetrySettings settings) {
        if (settings == null) {
            throw new RetryPolicyConfigurationException("Settings are missing the 'retry' section");
        }
        return new RetryPolicy(
                requirePresent("extract_retries", settings.getExtractRetries()),
                requirePresent("copy_data_retries", settings.getCopyDataRetries()),
                requirePresent("insert_data_retries", settings.getInsertDataRetries()));
    }

    public int retriesFor(EtlStage stage) {
        switch (stage) {
            case EXTRACT:
                return extractRetries;
            case COPY:
                return copyDataRetries;
            case INSERT:
                return insertDataRetries;
            default:
                throw new IllegalArgumentException("Unknown stage: " + stage);
        }
    }

    /** Total number of attempts a stage may make, the first one included. */
    public int maxAttemptsFor(EtlStage stage) {
        return retriesFor(stage) + 1;
    }

    private static int requirePresent(String name, Integer value) {
        if (value == null) {
            throw new RetryPolicyConfigurationException("Settings are missing 'retry." + name + "'");
        }
        return value;
    }

    private static int requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new RetryPolicyConfigurationException("'retry." + name + "' must not be negative but is " + value);
        }
        return value;
    }
}
