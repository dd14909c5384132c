package com.di.etlcontrol.typemap;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One entry of the ordered type catalog.
 *
 * <p>A rule's pattern is matched against the whole source type string (as produced by
 * {@code pg_catalog.format_type}), so {@code numeric} matches only the bare type and
 * {@code numeric\(\d+,\d+\)} only the parameterized one. The default rule has no pattern and
 * matches everything; {@link TypeRuleTable} only consults it after every other rule failed.
 */
public abstract class TypeRule {

    private final Pattern pattern;
    private final SerializationFormat serializationFormat;

    protected TypeRule(Pattern pattern, SerializationFormat serializationFormat) {
        if (serializationFormat == null) {
            throw new TypeMapConfigurationException("Serialization format is required for rule " + describe(pattern));
        }
        this.pattern = pattern;
        this.serializationFormat = serializationFormat;
    }

    public static AsIsRule asIs(String regex, SerializationFormat format) {
        return new AsIsRule(compile(regex), format);
    }

    public static CastNeededRule castNeeded(String regex, String targetType, String castTemplate,
                                            SerializationFormat format) {
        return new CastNeededRule(compile(regex), targetType, CastTemplate.parse(castTemplate), format);
    }

    /** The fallback rule used when nothing else matches. */
    public static CastNeededRule fallback(String targetType, String castTemplate, SerializationFormat format) {
        return new CastNeededRule(null, targetType, CastTemplate.parse(castTemplate), format);
    }

    /**
     * Compiles a type pattern. Anchors are implied by whole-string matching, so a pattern that
     * carries its own {@code ^} or {@code $} is rejected.
     */
    static Pattern compile(String regex) {
        if (regex == null || regex.isBlank()) {
            throw new TypeMapConfigurationException("Type pattern must not be empty");
        }
        if (regex.startsWith("^") || (regex.endsWith("$") && !regex.endsWith("\\$"))) {
            throw new TypeMapConfigurationException(
                    "Type pattern must not carry its own anchors (whole-string matching is implied): " + regex);
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new TypeMapConfigurationException("Unparsable type pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    public boolean matches(String sourceType) {
        if (pattern == null) {
            return true;
        }
        return sourceType != null && pattern.matcher(sourceType).matches();
    }

    public boolean isDefault() {
        return pattern == null;
    }

    /** Pattern text, or {@code null} for the default rule. */
    public String getPatternText() {
        return pattern != null ? pattern.pattern() : null;
    }

    public SerializationFormat getSerializationFormat() {
        return serializationFormat;
    }

    public abstract TypeCategory getCategory();

    /**
     * Builds the mapping for a column of the given source type.
     *
     * @param sourceType      the source type string this rule matched
     * @param columnReference the quoted column reference
     */
    public abstract ResolvedMapping toMapping(String sourceType, String columnReference);

    static String describe(Pattern pattern) {
        return pattern != null ? "'" + pattern.pattern() + "'" : "<default>";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + describe(pattern) + " -> " + serializationFormat + "]";
    }
}
