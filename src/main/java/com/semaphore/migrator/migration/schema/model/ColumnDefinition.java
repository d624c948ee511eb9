package com.semaphore.migrator.migration.schema.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single destination column as reported by {@code PRAGMA table_info}.
 */
@Value
@Builder(toBuilder = true)
public class ColumnDefinition {

    String name;

    /**
     * Declared type text exactly as written in the CREATE statement, may be empty.
     */
    String declaredType;

    ColumnType type;

    /**
     * Zero-based position in the table declaration.
     */
    int ordinal;

    boolean primaryKey;
    boolean autoincrement;
    boolean notNull;

    /**
     * Default value expression, {@code null} when the column declares none.
     */
    String defaultValue;

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
