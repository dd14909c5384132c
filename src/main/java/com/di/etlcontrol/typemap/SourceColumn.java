package com.di.etlcontrol.typemap;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A column as described by the upstream catalog: name, formatted type and NOT NULL constraint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceColumn {

    private String name;

    @JsonProperty("source_type")
    private String sourceType;

    @JsonProperty("not_null")
    private boolean notNull;
}
