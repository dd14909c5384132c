package com.di.etlcontrol.typemap.dto;

import com.di.etlcontrol.typemap.TableDesign;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Table design of one source table plus the COPY statement that extracts it.
 */
@Value
@Builder
public class TableDesignResponse {

    @JsonProperty("table_name")
    String tableName;

    @JsonProperty("table_design")
    TableDesign tableDesign;

    @JsonProperty("copy_statement")
    String copyStatement;
}
