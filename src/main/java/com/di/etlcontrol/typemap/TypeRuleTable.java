package com.di.etlcontrol.typemap;

import com.di.etlcontrol.config.TypeMapsSettings;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered catalog of {@link TypeRule}s with exactly one default rule.
 *
 * <p>Catalog order is semantic: rules are tried in order and the first match wins. When built from
 * settings, all as-is rules come first (in file order), followed by all cast-needed rules (in file
 * order). So {@code character varying(255)} is taken as-is while a bare {@code character varying}
 * falls through to its cast rule.
 */
@Slf4j
public final class TypeRuleTable {

    private final List<TypeRule> rules;
    private final CastNeededRule defaultRule;

    /**
     * @param catalog ordered rules; must contain exactly one default rule (its position is
     *                irrelevant, it is consulted last)
     * @throws TypeMapConfigurationException if the default rule is missing or duplicated, or two
     *                                       rules share a pattern
     */
    public TypeRuleTable(List<? extends TypeRule> catalog) {
        if (catalog == null) {
            throw new TypeMapConfigurationException("Type rule catalog is missing");
        }
        List<TypeRule> ordered = new ArrayList<>();
        Set<String> seenPatterns = new HashSet<>();
        CastNeededRule fallback = null;
        for (TypeRule rule : catalog) {
            if (rule == null) {
                throw new TypeMapConfigurationException("Type rule catalog contains a null rule");
            }
            if (rule.isDefault()) {
                if (fallback != null) {
                    throw new TypeMapConfigurationException("Type rule catalog has more than one default rule");
                }
                fallback = (CastNeededRule) rule;
                continue;
            }
            if (!seenPatterns.add(rule.getPatternText())) {
                throw new TypeMapConfigurationException(
                        "Type pattern '" + rule.getPatternText() + "' is declared more than once");
            }
            ordered.add(rule);
        }
        if (fallback == null) {
            throw new TypeMapConfigurationException("Type rule catalog has no default rule (default_att_type)");
        }
        this.rules = Collections.unmodifiableList(ordered);
        this.defaultRule = fallback;
    }

    /**
     * Builds the catalog from the {@code type_maps} settings section.
     *
     * @throws TypeMapConfigurationException if the section is missing or malformed
     */
    public static TypeRuleTable fromSettings(TypeMapsSettings settings) {
        if (settings == null) {
            throw new TypeMapConfigurationException("Settings are missing the 'type_maps' section");
        }
        List<TypeRule> catalog = new ArrayList<>();
        if (settings.getAsIsAttType() != null) {
            for (Map.Entry<String, String> entry : settings.getAsIsAttType().entrySet()) {
                catalog.add(TypeRule.asIs(entry.getKey(),
                        formatFor("as_is_att_type", entry.getKey(), entry.getValue())));
            }
        }
        if (settings.getCastNeededAttType() != null) {
            for (Map.Entry<String, List<String>> entry : settings.getCastNeededAttType().entrySet()) {
                String key = entry.getKey();
                List<String> triple = requireTriple("cast_needed_att_type." + key, entry.getValue());
                catalog.add(TypeRule.castNeeded(key, triple.get(0), triple.get(1),
                        formatFor("cast_needed_att_type", key, triple.get(2))));
            }
        }
        if (settings.getDefaultAttType() == null) {
            throw new TypeMapConfigurationException("Settings are missing 'type_maps.default_att_type'");
        }
        List<String> fallback = requireTriple("default_att_type", settings.getDefaultAttType());
        catalog.add(TypeRule.fallback(fallback.get(0), fallback.get(1),
                formatFor("default_att_type", "<default>", fallback.get(2))));

        TypeRuleTable table = new TypeRuleTable(catalog);
        log.info("[TYPE-MAP] Loaded {} type rule(s) plus default ({} -> {})",
                table.rules.size(), table.defaultRule.getTargetType(), table.defaultRule.getSerializationFormat());
        return table;
    }

    /** Returns the first rule matching the whole source type string, or the default rule. */
    public TypeRule ruleFor(String sourceType) {
        if (sourceType != null) {
            for (TypeRule rule : rules) {
                if (rule.matches(sourceType)) {
                    return rule;
                }
            }
        }
        return defaultRule;
    }

    /** Non-default rules in catalog order. */
    public List<TypeRule> getRules() {
        return rules;
    }

    public CastNeededRule getDefaultRule() {
        return defaultRule;
    }

    private static SerializationFormat formatFor(String section, String key, String value) {
        return SerializationFormat.fromWireName(value).orElseThrow(() -> new TypeMapConfigurationException(
                "Unknown serialization format '" + value + "' for " + section + "." + key));
    }

    private static List<String> requireTriple(String key, List<String> value) {
        if (value == null || value.size() != 3) {
            throw new TypeMapConfigurationException(
                    "Expected [target type, cast template, serialization format] for " + key + " but got " + value);
        }
        return value;
    }
}
