package com.semaphore.migrator.migration.ordering;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * Resolved processing order plus the per-table row ordering rules.
 */
@Value
@Builder
public class MigrationPlan {

    List<String> orderedTables;

    /**
     * Planned tables with a foreign key to themselves; their rows get a deferred second pass.
     */
    Set<String> selfReferencingTables;

    /**
     * Planned tables whose rows are sorted by a timestamp field, keyed by table name.
     */
    Map<String, String> chronologicalFields;

    public boolean isSelfReferencing(String table) {
        return selfReferencingTables.contains(table);
    }

    public Optional<String> chronologicalField(String table) {
        return Optional.ofNullable(chronologicalFields.get(table));
    }
}
