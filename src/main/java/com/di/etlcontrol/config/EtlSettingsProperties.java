package com.di.etlcontrol.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Where the ETL settings come from (application.yml / application-{profile}.yml).
 *
 * <pre>
 * etl:
 *   settings:
 *     settings-file: classpath:default_settings.yml
 *     override-files:
 *       - file:/etc/etl/production.yml
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "etl.settings")
public class EtlSettingsProperties {

    /** Base settings file, loaded first. */
    private String settingsFile = "classpath:default_settings.yml";

    /**
     * Files merged on top of the base file, in order. Within {@code type_maps} a later file replaces
     * whole sub-sections ({@code as_is_att_type}, ...); within {@code retry} it replaces single counters.
     */
    private List<String> overrideFiles = new ArrayList<>();
}
