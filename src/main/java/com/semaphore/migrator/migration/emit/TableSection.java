package com.semaphore.migrator.migration.emit;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything the script contains for one table, in resolved order.
 */
@Value
@Builder
public class TableSection {

    String tableName;

    /**
     * Shown next to the section marker, e.g. "sorted by created"; {@code null} for none.
     */
    String note;

    @Singular
    List<String> clearStatements;

    @Singular
    List<String> insertStatements;

    public boolean hasRows() {
        return !insertStatements.isEmpty();
    }
}
