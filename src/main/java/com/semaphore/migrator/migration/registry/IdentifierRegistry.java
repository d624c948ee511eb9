package com.semaphore.migrator.migration.registry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps (table, original identifier) to the surrogate key assigned during this run.
 *
 * Keys of a table form the sequence 1, 2, 3, ... in assignment order. One registry is built per
 * migration and passed explicitly through the pipeline; it is not thread-safe.
 */
public class IdentifierRegistry {

    private final Map<String, TableKeys> tables = new HashMap<>();

    /**
     * Declares that {@code table} gets new surrogate keys in this run. References to untracked
     * tables are left as they are.
     */
    public void track(String table) {
        tables.computeIfAbsent(table, k -> new TableKeys());
    }

    public boolean isTracked(String table) {
        return tables.containsKey(table);
    }

    /**
     * Returns the key of {@code originalId}, assigning the next one on first sight.
     */
    public long assign(String table, String originalId) {
        TableKeys keys = tables.get(table);
        if (keys == null) {
            throw new IllegalStateException("Table is not tracked by the identifier registry: " + table);
        }
        return keys.assigned.computeIfAbsent(originalId, id -> ++keys.lastKey);
    }

    public Optional<Long> lookup(String table, String originalId) {
        TableKeys keys = tables.get(table);
        if (keys == null || originalId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.assigned.get(originalId));
    }

    /**
     * Number of keys assigned so far for {@code table}; also the last key handed out.
     */
    public long assignedCount(String table) {
        TableKeys keys = tables.get(table);
        return keys == null ? 0 : keys.lastKey;
    }

    private static final class TableKeys {
        private final Map<String, Long> assigned = new HashMap<>();
        private long lastKey;
    }
}
