package com.semaphore.migrator.migration.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-table counts of a run, in processing order.
 */
public class MigrationReport {

    private final Map<String, TableReport> tables = new LinkedHashMap<>();

    public TableReport table(String tableName) {
        return tables.computeIfAbsent(tableName, TableReport::new);
    }

    public Map<String, TableReport> getTables() {
        return Collections.unmodifiableMap(tables);
    }

    public int getTotalDiscovered() {
        return tables.values().stream().mapToInt(TableReport::getDocumentsDiscovered).sum();
    }

    public int getTotalEmitted() {
        return tables.values().stream().mapToInt(TableReport::getRowsEmitted).sum();
    }

    public int getTotalSkipped() {
        return tables.values().stream().mapToInt(TableReport::getRowsSkipped).sum();
    }

    public int getTotalFallbacks() {
        return tables.values().stream().mapToInt(TableReport::getFallbackCoercions).sum();
    }
}
