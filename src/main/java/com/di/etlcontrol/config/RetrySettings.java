package com.di.etlcontrol.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * The {@code retry} settings section. Counters are boxed so that a missing value can be told
 * apart from zero.
 */
@Data
public class RetrySettings {

    @JsonProperty("extract_retries")
    private Integer extractRetries;

    @JsonProperty("copy_data_retries")
    private Integer copyDataRetries;

    @JsonProperty("insert_data_retries")
    private Integer insertDataRetries;
}
