package com.semaphore.migrator.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import com.semaphore.migrator.migration.schema.model.ColumnDefinition;
import com.semaphore.migrator.migration.schema.model.ColumnType;
import com.semaphore.migrator.migration.schema.model.ForeignKeyDefinition;

/**
 * Helpers shared by the tests: SQLite files, export trees and hand-built schema objects.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static Path createDatabase(Path file, String... ddl) throws SQLException {
        try (Connection connection = DriverManager.getConnection(url(file));
             Statement st = connection.createStatement()) {
            for (String statement : ddl) {
                st.executeUpdate(statement);
            }
        }
        return file;
    }

    /**
     * Runs a whole script (several statements) against the database.
     */
    public static void executeScript(Path database, String script) throws SQLException {
        try (Connection connection = DriverManager.getConnection(url(database));
             Statement st = connection.createStatement()) {
            st.executeUpdate(script);
        }
    }

    public static long count(Path database, String table) throws SQLException {
        try (Connection connection = DriverManager.getConnection(url(database));
             Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM \"" + table + "\"")) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    public static String queryString(Path database, String sql) throws SQLException {
        try (Connection connection = DriverManager.getConnection(url(database));
             Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    public static Path writeJson(Path dir, String fileName, String json) throws IOException {
        Files.createDirectories(dir);
        return Files.writeString(dir.resolve(fileName), json);
    }

    public static String url(Path database) {
        return "jdbc:sqlite:" + database.toAbsolutePath();
    }

    public static ColumnDefinition column(String name, ColumnType type) {
        return ColumnDefinition.builder()
                .name(name)
                .declaredType(type.name())
                .type(type)
                .build();
    }

    public static ColumnDefinition surrogateKey(String name) {
        return ColumnDefinition.builder()
                .name(name)
                .declaredType("INTEGER")
                .type(ColumnType.INTEGER)
                .primaryKey(true)
                .autoincrement(true)
                .notNull(true)
                .build();
    }

    public static ForeignKeyDefinition foreignKey(String column, String referencedTable, String referencedColumn) {
        return ForeignKeyDefinition.builder()
                .column(column)
                .referencedTable(referencedTable)
                .referencedColumn(referencedColumn)
                .build();
    }
}
