package com.di.etlcontrol.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Root of an ETL settings file.
 */
@Data
public class EtlSettings {

    @JsonProperty("type_maps")
    private TypeMapsSettings typeMaps;

    @JsonProperty("retry")
    private RetrySettings retry;

    @JsonProperty("table_selection")
    private TableSelectionSettings tableSelection;
}
