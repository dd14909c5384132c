package com.di.etlcontrol.typemap;

import lombok.EqualsAndHashCode;

/**
 * A SQL expression template with exactly one {@code %s} slot for the quoted column reference,
 * e.g. {@code %s::varchar(10000)} or {@code encode(%s, 'base64')}.
 *
 * <p>The template is split around its slot once, when it is parsed, so that a malformed template
 * is reported while the settings load rather than on the first column that uses it.
 * {@code %%} stands for a literal percent sign; any other {@code %} sequence is rejected.
 */
@EqualsAndHashCode(of = "template")
public final class CastTemplate {

    public static final String PLACEHOLDER = "%s";

    private final String template;
    private final String prefix;
    private final String suffix;

    private CastTemplate(String template, String prefix, String suffix) {
        this.template = template;
        this.prefix = prefix;
        this.suffix = suffix;
    }

    /**
     * Parses and validates a template.
     *
     * @throws TypeMapConfigurationException if the template is blank, has no slot, more than one
     *                                       slot, or an unsupported {@code %} sequence
     */
    public static CastTemplate parse(String template) {
        if (template == null || template.isBlank()) {
            throw new TypeMapConfigurationException("Cast template must not be empty");
        }
        StringBuilder prefix = new StringBuilder();
        StringBuilder suffix = new StringBuilder();
        StringBuilder current = prefix;
        int slots = 0;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c != '%') {
                current.append(c);
                continue;
            }
            if (i + 1 >= template.length()) {
                throw new TypeMapConfigurationException("Cast template ends with a dangling '%': " + template);
            }
            char next = template.charAt(++i);
            if (next == '%') {
                current.append('%');
            } else if (next == 's') {
                slots++;
                if (slots > 1) {
                    throw new TypeMapConfigurationException(
                            "Cast template must contain exactly one " + PLACEHOLDER + " placeholder, found more: " + template);
                }
                current = suffix;
            } else {
                throw new TypeMapConfigurationException(
                        "Cast template contains unsupported format sequence '%" + next + "': " + template);
            }
        }
        if (slots == 0) {
            throw new TypeMapConfigurationException(
                    "Cast template must contain exactly one " + PLACEHOLDER + " placeholder, found none: " + template);
        }
        return new CastTemplate(template, prefix.toString(), suffix.toString());
    }

    /** Builds the cast expression for an already quoted column reference. */
    public String apply(String columnReference) {
        return prefix + columnReference + suffix;
    }

    public String getTemplate() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }
}
