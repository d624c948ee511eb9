package com.semaphore.migrator.migration.schema;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.semaphore.migrator.migration.schema.model.ColumnType;

class ColumnTypeTest {

    @Test
    void testAffinityRules() {
        assertThat(ColumnType.fromDeclaredType("INTEGER")).isEqualTo(ColumnType.INTEGER);
        assertThat(ColumnType.fromDeclaredType("bigint")).isEqualTo(ColumnType.INTEGER);
        assertThat(ColumnType.fromDeclaredType("VARCHAR(255)")).isEqualTo(ColumnType.TEXT);
        assertThat(ColumnType.fromDeclaredType("longtext")).isEqualTo(ColumnType.TEXT);
        assertThat(ColumnType.fromDeclaredType("blob")).isEqualTo(ColumnType.BLOB);
        assertThat(ColumnType.fromDeclaredType("DOUBLE PRECISION")).isEqualTo(ColumnType.REAL);
        assertThat(ColumnType.fromDeclaredType("float")).isEqualTo(ColumnType.REAL);
        assertThat(ColumnType.fromDeclaredType("datetime")).isEqualTo(ColumnType.NUMERIC);
        assertThat(ColumnType.fromDeclaredType("boolean")).isEqualTo(ColumnType.NUMERIC);
    }

    @Test
    void testMissingTypeIsBlob() {
        assertThat(ColumnType.fromDeclaredType(null)).isEqualTo(ColumnType.BLOB);
        assertThat(ColumnType.fromDeclaredType("")).isEqualTo(ColumnType.BLOB);
    }

    @Test
    void testIntCheckedBeforeChar() {
        // "POINT" contains INT, so it gets INTEGER affinity like in SQLite
        assertThat(ColumnType.fromDeclaredType("POINT")).isEqualTo(ColumnType.INTEGER);
        assertThat(ColumnType.fromDeclaredType("CHARINT")).isEqualTo(ColumnType.INTEGER);
    }
}
