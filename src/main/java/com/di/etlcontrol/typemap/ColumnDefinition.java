package com.di.etlcontrol.typemap;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Column entry of a table design: the source and warehouse types, the SELECT expression (absent
 * for columns selected as they are) and the serialization type of the staging files.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnDefinition {

    String name;

    @JsonIgnore
    String sourceSqlType;

    @JsonProperty("sql_type")
    String sqlType;

    /** {@code null} when the column is selected by name. */
    String expression;

    @JsonProperty("serialization_format")
    SerializationFormat serializationFormat;

    @JsonProperty("not_null")
    boolean notNull;

    /** Source type, left out when the column keeps its type. */
    @JsonProperty("source_sql_type")
    public String getChangedSourceSqlType() {
        return sourceSqlType != null && sourceSqlType.equals(sqlType) ? null : sourceSqlType;
    }

    /**
     * Avro field type: the bare format for NOT NULL columns, otherwise the union
     * {@code ["null", format]}.
     */
    @JsonProperty("type")
    public Object getType() {
        if (notNull) {
            return serializationFormat.getWireName();
        }
        return List.of("null", serializationFormat.getWireName());
    }
}
