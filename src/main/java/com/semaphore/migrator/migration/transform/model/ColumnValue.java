package com.semaphore.migrator.migration.transform.model;

import lombok.Value;

@Value
public class ColumnValue {
    String column;
    SqlLiteral literal;
}
