package com.di.etlcontrol.monitor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Progress of one relation: units processed so far and the total to reach.
 */
@Value
@JsonPropertyOrder({"name", "current", "final"})
public class ProgressIndex {

    String name;
    long current;

    @JsonProperty("final")
    long finalIndex;

    @JsonIgnore
    public boolean isComplete() {
        return finalIndex > 0 && current == finalIndex;
    }

    /** Completion in percent, 0 while the final index is unknown. */
    @JsonIgnore
    public double getPercentage() {
        return finalIndex > 0 ? (100.0 * current) / finalIndex : 0.0;
    }
}
