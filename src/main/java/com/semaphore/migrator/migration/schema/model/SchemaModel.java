package com.semaphore.migrator.migration.schema.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory mirror of the destination schema. Every table of the catalog is kept, including
 * bookkeeping tables; filtering is left to the callers.
 */
public class SchemaModel {

    private final Map<String, TableDefinition> tables;

    public SchemaModel(List<TableDefinition> tables) {
        Map<String, TableDefinition> byName = new LinkedHashMap<>();
        for (TableDefinition table : tables) {
            byName.put(table.getName(), table);
        }
        this.tables = Collections.unmodifiableMap(byName);
    }

    public Optional<TableDefinition> getTable(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public TableDefinition requireTable(String name) {
        TableDefinition table = tables.get(name);
        if (table == null) {
            throw new IllegalArgumentException("Unknown table: " + name);
        }
        return table;
    }

    public boolean hasTable(String name) {
        return tables.containsKey(name);
    }

    public Set<String> getTableNames() {
        return tables.keySet();
    }

    public Collection<TableDefinition> getTables() {
        return tables.values();
    }

    /**
     * Foreign keys grouped by owning table, only for tables that declare at least one.
     */
    public Map<String, List<ForeignKeyDefinition>> relationships() {
        Map<String, List<ForeignKeyDefinition>> result = new LinkedHashMap<>();
        tables.values().stream()
                .filter(t -> !t.getForeignKeys().isEmpty())
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .forEach(t -> result.put(t.getName(), t.getForeignKeys()));
        return result;
    }
}
