package com.semaphore.migrator.migration.catalog.service;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps an export directory name to its destination table name.
 *
 * <ul>
 *   <li>{@code events} with override {@code events=event} -> {@code event}</li>
 *   <li>{@code project__template_0000000001} -> {@code project_template}</li>
 *   <li>{@code user} -> {@code user}</li>
 * </ul>
 */
public class TableNameResolver {

    /**
     * Destination-internal bookkeeping tables, never populated from source data.
     */
    public static final Set<String> EXCLUDED_TABLES = Set.of("migrations", "session");

    // <token>__<token>_<digits>; tokens may contain single underscores
    private static final Pattern RELATION_DIR_PATTERN = Pattern.compile(
            "^([A-Za-z0-9]+(?:_[A-Za-z0-9]+)*)__([A-Za-z0-9]+(?:_[A-Za-z0-9]+)*)_([0-9]+)$");

    private final Map<String, String> overrides;

    public TableNameResolver(Map<String, String> overrides) {
        this.overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public String resolve(String directoryName) {
        String override = overrides.get(directoryName);
        if (override != null) {
            return override;
        }
        Matcher m = RELATION_DIR_PATTERN.matcher(directoryName);
        if (m.matches()) {
            return m.group(1) + "_" + m.group(2);
        }
        return directoryName;
    }

    public static boolean isExcluded(String tableName) {
        return EXCLUDED_TABLES.contains(tableName);
    }
}
