package com.semaphore.migrator.migration.schema.service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import com.semaphore.migrator.migration.core.context.MigrationDiagnostics;
import com.semaphore.migrator.migration.schema.SchemaUnavailableException;
import com.semaphore.migrator.migration.schema.model.ColumnDefinition;
import com.semaphore.migrator.migration.schema.model.ColumnType;
import com.semaphore.migrator.migration.schema.model.ForeignKeyDefinition;
import com.semaphore.migrator.migration.schema.model.SchemaModel;
import com.semaphore.migrator.migration.schema.model.TableDefinition;

import lombok.NoArgsConstructor;

/**
 * Reads table, column and foreign key metadata from a SQLite destination through
 * {@code sqlite_master} and the {@code table_info} / {@code foreign_key_list} pragmas.
 * The connection is opened read-only and never written through.
 */
@NoArgsConstructor
public class SchemaLoaderService {

    private static final Logger log = LoggerFactory.getLogger(SchemaLoaderService.class);

    private static final String SQL_LIST_TABLES =
            "SELECT name, sql FROM sqlite_master WHERE type = 'table' ORDER BY rowid";
    private static final String PRAGMA_TABLE_INFO = "PRAGMA table_info(%s)";
    private static final String PRAGMA_FK_LIST = "PRAGMA foreign_key_list(%s)";

    public SchemaModel load(Path databasePath, MigrationDiagnostics diagnostics) {
        if (databasePath == null || !Files.isRegularFile(databasePath)) {
            throw new SchemaUnavailableException("Destination database not found: " + databasePath);
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        String url = "jdbc:sqlite:" + databasePath.toAbsolutePath();

        log.debug("Opening destination schema read-only: {}", url);
        try (Connection connection = DriverManager.getConnection(url, config.toProperties())) {
            List<TableDefinition> raw = readTables(connection);
            SchemaModel model = new SchemaModel(resolveForeignKeys(raw, diagnostics));
            log.info("Loaded {} tables from {}", model.getTableNames().size(), databasePath);
            return model;
        } catch (SQLException e) {
            throw new SchemaUnavailableException(
                    "Cannot read schema metadata from " + databasePath + ": " + e.getMessage(), e);
        }
    }

    private List<TableDefinition> readTables(Connection connection) throws SQLException {
        Map<String, String> createSqlByTable = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(SQL_LIST_TABLES);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                createSqlByTable.put(rs.getString("name"), rs.getString("sql"));
            }
        }

        List<TableDefinition> tables = new ArrayList<>();
        for (Map.Entry<String, String> entry : createSqlByTable.entrySet()) {
            String tableName = entry.getKey();
            String createSql = entry.getValue() == null ? "" : entry.getValue();

            TableDefinition.TableDefinitionBuilder builder = TableDefinition.builder()
                    .name(tableName)
                    .createSql(createSql)
                    .columns(readColumns(connection, tableName, createSql));

            for (ForeignKeyDefinition fk : readForeignKeys(connection, tableName)) {
                builder.foreignKey(fk);
            }
            tables.add(builder.build());
        }
        return tables;
    }

    private List<ColumnDefinition> readColumns(Connection connection, String table, String createSql)
            throws SQLException {
        List<ColumnDefinition> columns = new ArrayList<>();
        int pkCount = 0;

        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(String.format(PRAGMA_TABLE_INFO, quote(table)))) {
            while (rs.next()) {
                String declared = rs.getString("type");
                boolean pk = rs.getInt("pk") > 0;
                if (pk) {
                    pkCount++;
                }
                columns.add(ColumnDefinition.builder()
                        .name(rs.getString("name"))
                        .declaredType(declared == null ? "" : declared)
                        .type(ColumnType.fromDeclaredType(declared))
                        .ordinal(rs.getInt("cid"))
                        .primaryKey(pk)
                        .notNull(rs.getInt("notnull") != 0)
                        .defaultValue(rs.getString("dflt_value"))
                        .build());
            }
        }

        if (pkCount != 1) {
            return columns;
        }

        // A single INTEGER PRIMARY KEY is a rowid alias; AUTOINCREMENT additionally keeps a sqlite_sequence row.
        boolean declaresAutoincrement = createSql.toUpperCase(Locale.ROOT).contains("AUTOINCREMENT");
        List<ColumnDefinition> result = new ArrayList<>(columns.size());
        for (ColumnDefinition column : columns) {
            boolean rowidAlias = column.isPrimaryKey() && "INTEGER".equalsIgnoreCase(column.getDeclaredType().trim());
            if (column.isPrimaryKey() && (declaresAutoincrement || rowidAlias)) {
                result.add(column.toBuilder().autoincrement(true).build());
            } else {
                result.add(column);
            }
        }
        return result;
    }

    private List<ForeignKeyDefinition> readForeignKeys(Connection connection, String table) throws SQLException {
        List<ForeignKeyDefinition> foreignKeys = new ArrayList<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(String.format(PRAGMA_FK_LIST, quote(table)))) {
            while (rs.next()) {
                foreignKeys.add(ForeignKeyDefinition.builder()
                        .column(rs.getString("from"))
                        .referencedTable(rs.getString("table"))
                        .referencedColumn(rs.getString("to"))
                        .build());
            }
        }
        return foreignKeys;
    }

    /**
     * Drops constraints pointing at unknown tables and fills in implicit referenced columns
     * ({@code REFERENCES parent} without a column list means the parent's primary key).
     */
    private List<TableDefinition> resolveForeignKeys(List<TableDefinition> tables, MigrationDiagnostics diagnostics) {
        Map<String, TableDefinition> byName = new LinkedHashMap<>();
        tables.forEach(t -> byName.put(t.getName(), t));

        List<TableDefinition> resolved = new ArrayList<>(tables.size());
        for (TableDefinition table : tables) {
            List<ForeignKeyDefinition> kept = new ArrayList<>();
            for (ForeignKeyDefinition fk : table.getForeignKeys()) {
                TableDefinition target = byName.get(fk.getReferencedTable());
                if (target == null) {
                    String msg = String.format("Ignoring foreign key %s.%s: referenced table '%s' does not exist",
                            table.getName(), fk.getColumn(), fk.getReferencedTable());
                    diagnostics.getWarnings().add(msg);
                    log.warn(msg);
                    continue;
                }
                if (fk.getReferencedColumn() == null) {
                    List<ColumnDefinition> targetPk = target.getPrimaryKeyColumns();
                    String implicit = targetPk.size() == 1 ? targetPk.get(0).getName() : null;
                    kept.add(fk.toBuilder().referencedColumn(implicit).build());
                } else {
                    kept.add(fk);
                }
            }
            resolved.add(table.toBuilder().clearForeignKeys().foreignKeys(kept).build());
        }
        return resolved;
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
