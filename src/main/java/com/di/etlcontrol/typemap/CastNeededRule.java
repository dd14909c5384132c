package com.di.etlcontrol.typemap;

import java.util.regex.Pattern;

/**
 * Source type that needs an explicit conversion: the warehouse column gets {@link #getTargetType()}
 * and the value is selected through the {@link CastTemplate}.
 */
public final class CastNeededRule extends TypeRule {

    private final String targetType;
    private final CastTemplate castTemplate;

    CastNeededRule(Pattern pattern, String targetType, CastTemplate castTemplate,
                   SerializationFormat serializationFormat) {
        super(pattern, serializationFormat);
        if (targetType == null || targetType.isBlank()) {
            throw new TypeMapConfigurationException("Target type is required for rule " + describe(pattern));
        }
        this.targetType = targetType.trim();
        this.castTemplate = castTemplate;
    }

    public String getTargetType() {
        return targetType;
    }

    public CastTemplate getCastTemplate() {
        return castTemplate;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.CAST_NEEDED;
    }

    @Override
    public ResolvedMapping toMapping(String sourceType, String columnReference) {
        return ResolvedMapping.builder()
                .targetType(targetType)
                .castExpression(castTemplate.apply(columnReference))
                .serializationFormat(getSerializationFormat())
                .category(TypeCategory.CAST_NEEDED)
                .matchedPattern(getPatternText())
                .build();
    }
}
