package com.semaphore.migrator.migration.schema.model;

import java.util.Locale;

/**
 * Declared type category of a destination column, derived with SQLite's affinity rules.
 */
public enum ColumnType {
    INTEGER,
    REAL,
    TEXT,
    BLOB,
    NUMERIC;

    /**
     * Maps a declared column type ("VARCHAR(255)", "bigint", "datetime", ...) to its category.
     * Rules are checked in SQLite's order, so "CHARINT" is INTEGER.
     */
    public static ColumnType fromDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            return BLOB;
        }
        String upper = declaredType.toUpperCase(Locale.ROOT);
        if (upper.contains("INT")) {
            return INTEGER;
        }
        if (upper.contains("CHAR") || upper.contains("CLOB") || upper.contains("TEXT")) {
            return TEXT;
        }
        if (upper.contains("BLOB")) {
            return BLOB;
        }
        if (upper.contains("REAL") || upper.contains("FLOA") || upper.contains("DOUB")) {
            return REAL;
        }
        return NUMERIC;
    }
}
