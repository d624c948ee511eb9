package com.semaphore.migrator.migration.transform.model;

import java.util.List;
import java.util.Optional;

import lombok.Value;

/**
 * A fully typed row ready for serialization. Column order is the order of the insert's column list.
 */
@Value
public class Row {

    String table;
    List<ColumnValue> values;

    public Row(String table, List<ColumnValue> values) {
        this.table = table;
        this.values = List.copyOf(values);
    }

    public Optional<SqlLiteral> get(String column) {
        return values.stream()
                .filter(v -> v.getColumn().equals(column))
                .map(ColumnValue::getLiteral)
                .findFirst();
    }

    public List<String> getColumns() {
        return values.stream().map(ColumnValue::getColumn).toList();
    }
}
