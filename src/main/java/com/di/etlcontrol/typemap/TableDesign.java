package com.di.etlcontrol.typemap;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Starting point of a warehouse table design: an Avro-style record of the mapped columns plus the
 * key and distribution settings of the warehouse table.
 *
 * <pre>
 * {"type": "record", "name": "www.orders", "source_name": "www.public.orders",
 *  "fields": [...],
 *  "table_constraints": {"primary_key": ["id"]},
 *  "table_attributes": {"diststyle": "even", "sortkey": ["id"]}}
 * </pre>
 */
@Value
@Builder
@JsonPropertyOrder({"type", "name", "source_name", "fields", "table_constraints", "table_attributes"})
public class TableDesign {

    public static final String RECORD_TYPE = "record";

    /** Target name: the source name as schema plus the source table. */
    String name;

    /** Source name followed by the source schema and table. */
    @JsonProperty("source_name")
    String sourceName;

    List<ColumnDefinition> fields;

    @JsonProperty("table_constraints")
    TableConstraints tableConstraints;

    @JsonProperty("table_attributes")
    TableAttributes tableAttributes;

    @JsonProperty("type")
    public String getType() {
        return RECORD_TYPE;
    }

    @Value
    public static class TableConstraints {
        @JsonProperty("primary_key")
        List<String> primaryKey;
    }

    @Value
    public static class TableAttributes {
        String diststyle;
        List<String> sortkey;
    }
}
