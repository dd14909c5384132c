package com.di.etlcontrol.typemap;

import java.util.regex.Pattern;

/**
 * Source type usable in the warehouse without transformation: the target type is the source
 * type itself and the column is selected by its plain quoted reference.
 */
public final class AsIsRule extends TypeRule {

    AsIsRule(Pattern pattern, SerializationFormat serializationFormat) {
        super(pattern, serializationFormat);
        if (pattern == null) {
            throw new TypeMapConfigurationException("An as-is rule needs a pattern; only cast rules may be the default");
        }
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.AS_IS;
    }

    @Override
    public ResolvedMapping toMapping(String sourceType, String columnReference) {
        return ResolvedMapping.builder()
                .targetType(sourceType)
                .castExpression(columnReference)
                .serializationFormat(getSerializationFormat())
                .category(TypeCategory.AS_IS)
                .matchedPattern(getPatternText())
                .build();
    }
}
