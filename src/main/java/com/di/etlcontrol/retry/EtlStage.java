package com.di.etlcontrol.retry;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phases of the pipeline that carry their own retry budget.
 */
public enum EtlStage {

    /** Upstream source to staging files. */
    EXTRACT("extract"),
    /** Staging files into the warehouse's staging tables. */
    COPY("copy"),
    /** Staging tables into the final relations. */
    INSERT("insert");

    private final String stepName;

    EtlStage(String stepName) {
        this.stepName = stepName;
    }

    /** Name used as the {@code step} of event records. */
    @JsonValue
    public String getStepName() {
        return stepName;
    }
}
