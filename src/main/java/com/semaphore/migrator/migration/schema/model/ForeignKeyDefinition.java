package com.semaphore.migrator.migration.schema.model;

import lombok.Builder;
import lombok.Value;

/**
 * Foreign key constraint: {@code column} references {@code referencedTable.referencedColumn}.
 */
@Value
@Builder(toBuilder = true)
public class ForeignKeyDefinition {

    String column;
    String referencedTable;
    String referencedColumn;

    public boolean isSelfReference(String owningTable) {
        return owningTable.equals(referencedTable);
    }

    @Override
    public String toString() {
        return column + " -> " + referencedTable + "." + referencedColumn;
    }
}
