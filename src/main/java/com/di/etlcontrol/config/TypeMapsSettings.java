package com.di.etlcontrol.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code type_maps} settings section. Maps keep file order; the order of entries decides which
 * rule wins when several patterns match a type.
 *
 * <pre>
 * type_maps:
 *   as_is_att_type:
 *     "integer": "int"
 *     "numeric\\(\\d+,\\d+\\)": "string"
 *   cast_needed_att_type:
 *     "text": ["varchar(10000)", "%s::varchar(10000)", "string"]
 *   default_att_type: ["varchar(10000)", "%s::varchar(10000)", "string"]
 * </pre>
 */
@Data
public class TypeMapsSettings {

    /** Pattern -> serialization format. */
    @JsonProperty("as_is_att_type")
    private Map<String, String> asIsAttType = new LinkedHashMap<>();

    /** Pattern -> [target type, cast template, serialization format]. */
    @JsonProperty("cast_needed_att_type")
    private Map<String, List<String>> castNeededAttType = new LinkedHashMap<>();

    /** [target type, cast template, serialization format] used when nothing else matches. */
    @JsonProperty("default_att_type")
    private List<String> defaultAttType;
}
