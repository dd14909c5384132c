package com.di.etlcontrol.typemap;

import com.di.etlcontrol.config.TableSelectionSettings;
import com.di.etlcontrol.exception.EtlConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Picks the relations to extract from the relations found in the source catalog.
 *
 * <p>A relation is selected when its {@code schema.table} matches at least one include pattern,
 * matches no exclude pattern, and its table name matches the optional subset pattern. Exclusion
 * wins over inclusion. Patterns are globs ({@code *}, {@code ?}, {@code [abc]}, {@code {a,b}});
 * matching is case-sensitive.
 */
@Slf4j
public class TableSelector {

    private final List<String> includePatterns;
    private final List<String> excludePatterns;
    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;

    /**
     * @throws IllegalArgumentException if a pattern is blank or not a valid glob
     */
    public TableSelector(List<String> includePatterns, List<String> excludePatterns) {
        this.includePatterns = includePatterns == null ? List.of() : List.copyOf(includePatterns);
        this.excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        this.includes = this.includePatterns.stream().map(TableSelector::compile).collect(Collectors.toList());
        this.excludes = this.excludePatterns.stream().map(TableSelector::compile).collect(Collectors.toList());
    }

    /**
     * @throws EtlConfigurationException if the section or its include list is missing, or a pattern is invalid
     */
    public static TableSelector fromSettings(TableSelectionSettings settings) {
        if (settings == null || settings.getIncludeTables() == null) {
            throw new EtlConfigurationException("Settings are missing table_selection.include_tables");
        }
        try {
            TableSelector selector = new TableSelector(settings.getIncludeTables(), settings.getExcludeTables());
            log.info("[TYPE-MAP] Table selection: include={}, exclude={}",
                    selector.includePatterns, selector.excludePatterns);
            return selector;
        } catch (IllegalArgumentException e) {
            throw new EtlConfigurationException("Invalid table_selection pattern: " + e.getMessage(), e);
        }
    }

    public boolean isSelected(TableName relation) {
        Path identifier = Path.of(relation.getIdentifier());
        if (excludes.stream().anyMatch(m -> m.matches(identifier))) {
            return false;
        }
        return includes.stream().anyMatch(m -> m.matches(identifier));
    }

    /**
     * Selected relations in the order given.
     *
     * @param subsetPattern optional glob over the bare table name; {@code null} or blank selects all
     */
    public List<TableName> select(Collection<TableName> relations, String subsetPattern) {
        PathMatcher subset = (subsetPattern == null || subsetPattern.isBlank()) ? null : compile(subsetPattern);
        List<TableName> selected = relations.stream()
                .filter(this::isSelected)
                .filter(r -> subset == null || subset.matches(Path.of(r.getTable())))
                .collect(Collectors.toList());
        log.info("[TYPE-MAP] Found {} of {} relation(s) matching patterns; include={}, exclude={}, subset={}",
                selected.size(), relations.size(), includePatterns, excludePatterns,
                subset == null ? "*" : subsetPattern);
        return selected;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    private static PathMatcher compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Table pattern cannot be empty");
        }
        try {
            return FileSystems.getDefault().getPathMatcher("glob:" + pattern.trim());
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid table pattern '" + pattern + "': " + e.getDescription(), e);
        }
    }
}
