package com.di.etlcontrol.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * The {@code table_selection} settings section: glob patterns over {@code schema.table}.
 */
@Data
public class TableSelectionSettings {

    @JsonProperty("include_tables")
    private List<String> includeTables;

    @JsonProperty("exclude_tables")
    private List<String> excludeTables;
}
