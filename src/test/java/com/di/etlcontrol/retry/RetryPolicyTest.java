package com.di.etlcontrol.retry;

import com.di.etlcontrol.config.RetrySettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for RetryPolicy.
 */
@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

    private static RetrySettings settings(Integer extract, Integer copy, Integer insert) {
        RetrySettings settings = new RetrySettings();
        settings.setExtractRetries(extract);
        settings.setCopyDataRetries(copy);
        settings.setInsertDataRetries(insert);
        return settings;
    }

    @Test
    @DisplayName("Should expose the budget of every stage")
    void testRetriesFor() {
        RetryPolicy policy = RetryPolicy.fromSettings(settings(1, 3, 2));
        assertEquals(1, policy.retriesFor(EtlStage.EXTRACT));
        assertEquals(3, policy.retriesFor(EtlStage.COPY));
        assertEquals(2, policy.retriesFor(EtlStage.INSERT));
        assertEquals(4, policy.maxAttemptsFor(EtlStage.COPY));
    }

    @Test
    @DisplayName("Should treat zero as fail on first error")
    void testZeroDisablesRetries() {
        RetryPolicy policy = RetryPolicy.fromSettings(settings(0, 0, 0));
        assertEquals(0, policy.retriesFor(EtlStage.EXTRACT));
        assertEquals(1, policy.maxAttemptsFor(EtlStage.EXTRACT));
    }

    @Test
    @DisplayName("Should reject a missing retry section")
    void testMissingSection() {
        assertThrows(RetryPolicyConfigurationException.class, () -> RetryPolicy.fromSettings(null));
    }

    @Test
    @DisplayName("Should reject a missing counter instead of defaulting it")
    void testMissingCounter() {
        RetryPolicyConfigurationException ex = assertThrows(RetryPolicyConfigurationException.class,
                () -> RetryPolicy.fromSettings(settings(1, null, 3)));
        assertTrue(ex.getMessage().contains("copy_data_retries"));
    }

    @Test
    @DisplayName("Should reject negative counters")
    void testNegativeCounter() {
        assertThrows(RetryPolicyConfigurationException.class, () -> new RetryPolicy(1, 1, -1));
    }

    @Test
    @DisplayName("Should use stage step names for events")
    void testStageStepNames() {
        assertEquals("extract", EtlStage.EXTRACT.getStepName());
        assertEquals("copy", EtlStage.COPY.getStepName());
        assertEquals("insert", EtlStage.INSERT.getStepName());
    }
}
