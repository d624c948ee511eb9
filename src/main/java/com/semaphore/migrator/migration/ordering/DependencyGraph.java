package com.semaphore.migrator.migration.ordering;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.semaphore.migrator.migration.schema.model.ForeignKeyDefinition;
import com.semaphore.migrator.migration.schema.model.SchemaModel;
import com.semaphore.migrator.migration.schema.model.TableDefinition;

/**
 * Foreign key edges between tables: {@code A -> B} when A references B.
 * Self references are tracked apart from the edges.
 */
public class DependencyGraph {

    private final Map<String, SortedSet<String>> dependencies = new TreeMap<>();
    private final SortedSet<String> selfReferencing = new TreeSet<>();

    public static DependencyGraph fromSchema(SchemaModel schema) {
        DependencyGraph graph = new DependencyGraph();
        for (TableDefinition table : schema.getTables()) {
            for (ForeignKeyDefinition fk : table.getForeignKeys()) {
                graph.addEdge(table.getName(), fk.getReferencedTable());
            }
        }
        return graph;
    }

    public DependencyGraph addEdge(String table, String referencedTable) {
        if (table.equals(referencedTable)) {
            selfReferencing.add(table);
        } else {
            dependencies.computeIfAbsent(table, k -> new TreeSet<>()).add(referencedTable);
        }
        return this;
    }

    /**
     * Tables {@code table} references, self excluded.
     */
    public SortedSet<String> dependenciesOf(String table) {
        SortedSet<String> deps = dependencies.get(table);
        return deps == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(deps);
    }

    public boolean isSelfReferencing(String table) {
        return selfReferencing.contains(table);
    }

    public Set<String> getSelfReferencingTables() {
        return Collections.unmodifiableSortedSet(selfReferencing);
    }
}
