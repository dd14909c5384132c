package com.di.etlcontrol.typemap;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Result of resolving one source column: the warehouse type, the SELECT expression producing a
 * value of that type, and the wire format used in the staging files.
 */
@Value
@Builder
public class ResolvedMapping {

    String targetType;
    /** For as-is columns this is the plain quoted column reference. */
    String castExpression;
    SerializationFormat serializationFormat;
    TypeCategory category;
    /** Pattern of the rule that matched; {@code null} when the default rule applied. */
    String matchedPattern;

    @JsonIgnore
    public boolean isDefaultMapping() {
        return matchedPattern == null;
    }

    @JsonIgnore
    public boolean isCastNeeded() {
        return category == TypeCategory.CAST_NEEDED;
    }
}
