package com.di.etlcontrol.config;

import com.di.etlcontrol.exception.EtlConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the ETL settings: the base settings file followed by any override files, merged section by
 * section. Any unreadable or missing file is a configuration error; the run must not start on
 * partial settings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EtlSettingsLoaderService {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;
    private final EtlSettingsProperties properties;

    public EtlSettings load() {
        List<String> locations = new ArrayList<>();
        locations.add(properties.getSettingsFile());
        if (properties.getOverrideFiles() != null) {
            locations.addAll(properties.getOverrideFiles());
        }
        EtlSettings merged = new EtlSettings();
        for (String location : locations) {
            merge(merged, read(location));
        }
        return merged;
    }

    /** Reads one settings file. */
    EtlSettings read(String location) {
        if (location == null || location.isBlank()) {
            throw new EtlConfigurationException("Settings file location is empty");
        }
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            throw new EtlConfigurationException("Settings file not found: " + location);
        }
        log.info("[SETTINGS] Loading settings from '{}'", location);
        try (InputStream in = resource.getInputStream()) {
            EtlSettings settings = YAML_MAPPER.readValue(in, EtlSettings.class);
            return settings != null ? settings : new EtlSettings();
        } catch (IOException e) {
            throw new EtlConfigurationException("Failed to read settings file '" + location + "': " + e.getMessage(), e);
        }
    }

    /** Merges {@code update} into {@code target}; non-null values of {@code update} win. */
    static void merge(EtlSettings target, EtlSettings update) {
        TypeMapsSettings newTypeMaps = update.getTypeMaps();
        if (newTypeMaps != null) {
            if (target.getTypeMaps() == null) {
                target.setTypeMaps(newTypeMaps);
            } else {
                TypeMapsSettings typeMaps = target.getTypeMaps();
                if (newTypeMaps.getAsIsAttType() != null && !newTypeMaps.getAsIsAttType().isEmpty()) {
                    typeMaps.setAsIsAttType(newTypeMaps.getAsIsAttType());
                }
                if (newTypeMaps.getCastNeededAttType() != null && !newTypeMaps.getCastNeededAttType().isEmpty()) {
                    typeMaps.setCastNeededAttType(newTypeMaps.getCastNeededAttType());
                }
                if (newTypeMaps.getDefaultAttType() != null) {
                    typeMaps.setDefaultAttType(newTypeMaps.getDefaultAttType());
                }
            }
        }
        RetrySettings newRetry = update.getRetry();
        if (newRetry != null) {
            if (target.getRetry() == null) {
                target.setRetry(newRetry);
            } else {
                RetrySettings retry = target.getRetry();
                if (newRetry.getExtractRetries() != null) retry.setExtractRetries(newRetry.getExtractRetries());
                if (newRetry.getCopyDataRetries() != null) retry.setCopyDataRetries(newRetry.getCopyDataRetries());
                if (newRetry.getInsertDataRetries() != null) retry.setInsertDataRetries(newRetry.getInsertDataRetries());
            }
        }
        TableSelectionSettings newSelection = update.getTableSelection();
        if (newSelection != null) {
            if (target.getTableSelection() == null) {
                target.setTableSelection(newSelection);
            } else {
                TableSelectionSettings selection = target.getTableSelection();
                if (newSelection.getIncludeTables() != null) selection.setIncludeTables(newSelection.getIncludeTables());
                if (newSelection.getExcludeTables() != null) selection.setExcludeTables(newSelection.getExcludeTables());
            }
        }
    }
}
