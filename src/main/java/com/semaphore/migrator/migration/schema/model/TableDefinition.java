package com.semaphore.migrator.migration.schema.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Destination table: ordered columns plus its foreign key constraints.
 */
@Value
@Builder(toBuilder = true)
public class TableDefinition {

    String name;

    @Singular
    List<ColumnDefinition> columns;

    @Singular
    List<ForeignKeyDefinition> foreignKeys;

    String createSql;

    public Optional<ColumnDefinition> getColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equals(columnName))
                .findFirst();
    }

    public List<ColumnDefinition> getPrimaryKeyColumns() {
        return columns.stream()
                .filter(ColumnDefinition::isPrimaryKey)
                .toList();
    }

    /**
     * The column whose values are re-assigned as sequential surrogate keys: the single
     * primary key column, when it is autoincrement-style.
     */
    public Optional<ColumnDefinition> getSurrogateKeyColumn() {
        List<ColumnDefinition> pk = getPrimaryKeyColumns();
        if (pk.size() != 1 || !pk.get(0).isAutoincrement()) {
            return Optional.empty();
        }
        return Optional.of(pk.get(0));
    }

    public boolean isSurrogateKeyed() {
        return getSurrogateKeyColumn().isPresent();
    }

    public Optional<ForeignKeyDefinition> getForeignKeyFor(String columnName) {
        return foreignKeys.stream()
                .filter(fk -> fk.getColumn().equals(columnName))
                .findFirst();
    }

    /**
     * True when the CREATE statement uses {@code AUTOINCREMENT}, i.e. the table keeps a row in
     * {@code sqlite_sequence}. A plain {@code INTEGER PRIMARY KEY} does not.
     */
    public boolean declaresAutoincrement() {
        return createSql != null && createSql.toUpperCase(Locale.ROOT).contains("AUTOINCREMENT");
    }

    public boolean isSelfReferencing() {
        return foreignKeys.stream().anyMatch(fk -> fk.isSelfReference(name));
    }
}
