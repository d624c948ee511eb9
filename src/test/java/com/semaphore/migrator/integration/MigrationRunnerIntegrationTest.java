package com.semaphore.migrator.integration;

import static com.semaphore.migrator.support.TestFixtures.count;
import static com.semaphore.migrator.support.TestFixtures.createDatabase;
import static com.semaphore.migrator.support.TestFixtures.executeScript;
import static com.semaphore.migrator.support.TestFixtures.queryString;
import static com.semaphore.migrator.support.TestFixtures.writeJson;
import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.semaphore.migrator.migration.MigrationResult;
import com.semaphore.migrator.migration.MigrationRunner;
import com.semaphore.migrator.migration.core.context.MigrationConfig;
import com.semaphore.migrator.migration.report.TableReport;
import com.semaphore.migrator.migration.transform.model.SkipReason;

/**
 * End-to-end runs against real SQLite databases and export trees.
 */
class MigrationRunnerIntegrationTest {

    private static final String[] SCHEMA = {
            "CREATE TABLE account (id INTEGER PRIMARY KEY AUTOINCREMENT, name TEXT NOT NULL)",
            "CREATE TABLE project (id INTEGER PRIMARY KEY AUTOINCREMENT, name TEXT, "
                    + "account_id INTEGER REFERENCES account(id), alert BOOLEAN NOT NULL DEFAULT 0)",
            "CREATE TABLE project_something (id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "project_id INTEGER REFERENCES project(id), value TEXT)",
            "CREATE TABLE event (id INTEGER PRIMARY KEY AUTOINCREMENT, project_id INTEGER REFERENCES project(id), "
                    + "description TEXT, created DATETIME)",
            "CREATE TABLE migrations (version INTEGER PRIMARY KEY, upgraded_date DATETIME)",
            "CREATE TABLE session (id INTEGER PRIMARY KEY AUTOINCREMENT, user_id INTEGER)"
    };

    @TempDir
    Path tempDir;

    private Path database;
    private Path exportDir;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        database = createDatabase(tempDir.resolve("database.sqlite"), SCHEMA);
        exportDir = Files.createDirectories(tempDir.resolve("export"));
        output = tempDir.resolve("out").resolve("migrated_data.sql");
    }

    @Test
    void testAccountProjectScenario() throws Exception {
        writeJson(exportDir.resolve("account"), "0000000017.json", "{\"id\": 17, \"name\": \"Acme\"}");
        writeJson(exportDir.resolve("account"), "0000000003.json", "{\"id\": 3, \"name\": \"Beta\"}");
        writeJson(exportDir.resolve("project"), "0000000009.json",
                "{\"id\": 9, \"name\": \"Demo\", \"account_id\": 17}");
        writeJson(exportDir.resolve("project__something_0000000001"), "0000000005.json",
                "{\"id\": 5, \"project_id\": 9, \"value\": \"x\"}");

        MigrationResult result = run(config().build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProcessingOrder()).containsExactly("account", "project", "project_something");
        assertThat(output).exists();

        String script = Files.readString(output);
        assertThat(script)
                .contains("INSERT INTO \"account\" (\"id\", \"name\") VALUES (1, 'Beta');")
                .contains("INSERT INTO \"account\" (\"id\", \"name\") VALUES (2, 'Acme');")
                .contains("INSERT INTO \"project\" (\"id\", \"name\", \"account_id\") VALUES (1, 'Demo', 2);")
                .contains("INSERT INTO \"project_something\" (\"id\", \"project_id\", \"value\") VALUES (1, 1, 'x');")
                .doesNotContain("17");
        assertThat(script.indexOf("-- SQL statements for table: account"))
                .isLessThan(script.indexOf("-- SQL statements for table: project"));

        executeScript(database, script);
        assertThat(count(database, "account")).isEqualTo(2);
        assertThat(queryString(database, "SELECT a.name FROM project p JOIN account a ON p.account_id = a.id"))
                .isEqualTo("Acme");
        assertThat(queryString(database, "SELECT alert FROM project WHERE id = 1")).isEqualTo("0");
        assertThat(queryString(database, "SELECT MAX(id) FROM account")).isEqualTo("2");
    }

    @Test
    void testMissingParentScenario() throws Exception {
        writeJson(exportDir.resolve("account"), "1.json", "{\"id\": 1, \"name\": \"Acme\"}");
        writeJson(exportDir.resolve("project"), "1.json", "{\"id\": 1, \"name\": \"kept\", \"account_id\": 1}");
        writeJson(exportDir.resolve("project"), "2.json", "{\"id\": 2, \"name\": \"orphan\", \"account_id\": 99}");
        writeJson(exportDir.resolve("project__something_0000000001"), "1.json",
                "{\"id\": 1, \"project_id\": 2, \"value\": \"child of orphan\"}");

        MigrationResult result = run(config().build());

        assertThat(result.isSuccess()).isTrue();
        TableReport project = result.getReport().getTables().get("project");
        assertThat(project.getRowsEmitted()).isEqualTo(1);
        assertThat(project.getSkipped(SkipReason.MISSING_PARENT)).isEqualTo(1);
        assertThat(result.getReport().getTables().get("project_something").getSkipped(SkipReason.MISSING_PARENT))
                .isEqualTo(1);
        assertThat(result.getScript()).doesNotContain("orphan");
        assertThat(result.getDiagnostics().getWarnings()).anyMatch(w -> w.contains("account_id=99"));

        executeScript(database, result.getScript());
        assertThat(queryString(database,
                "SELECT COUNT(*) FROM project p LEFT JOIN account a ON p.account_id = a.id "
                        + "WHERE p.account_id IS NOT NULL AND a.id IS NULL")).isEqualTo("0");
        assertThat(count(database, "project_something")).isZero();
    }

    @Test
    void testCycleIsFatalAndWritesNothing() throws Exception {
        Path cyclic = createDatabase(tempDir.resolve("cyclic.sqlite"),
                "CREATE TABLE a (id INTEGER PRIMARY KEY AUTOINCREMENT, b_id INTEGER REFERENCES b(id))",
                "CREATE TABLE b (id INTEGER PRIMARY KEY AUTOINCREMENT, a_id INTEGER REFERENCES a(id))");
        writeJson(exportDir.resolve("a"), "1.json", "{\"id\": 1, \"b_id\": 1}");
        writeJson(exportDir.resolve("b"), "1.json", "{\"id\": 1, \"a_id\": 1}");

        MigrationResult result = run(config().databasePath(cyclic).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("{a, b}");
        assertThat(result.getDiagnostics().getErrors()).hasSize(1);
        assertThat(output).doesNotExist();
    }

    @Test
    void testMissingDatabaseIsFatal() {
        MigrationResult result = run(config().databasePath(tempDir.resolve("absent.sqlite")).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("absent.sqlite");
        assertThat(output).doesNotExist();
    }

    @Test
    void testEventsAreSortedByCreated() throws Exception {
        writeJson(exportDir.resolve("project"), "1.json", "{\"id\": 1, \"name\": \"P\"}");
        writeJson(exportDir.resolve("events"), "a.json",
                "{\"id\": 30, \"project_id\": 1, \"description\": \"late\", \"created\": \"2024-05-03T10:00:00Z\"}");
        writeJson(exportDir.resolve("events"), "b.json",
                "{\"id\": 10, \"project_id\": 1, \"description\": \"early\", \"created\": \"2024-05-01T10:00:00Z\"}");
        writeJson(exportDir.resolve("events"), "c.json",
                "{\"id\": 20, \"project_id\": 1, \"description\": \"middle\", \"created\": \"2024-05-02T10:00:00Z\"}");

        MigrationResult result = run(config().tableNameOverride("events", "event").build());

        assertThat(result.isSuccess()).isTrue();
        String script = result.getScript();
        assertThat(script).contains("-- SQL statements for table: event (sorted by created)");
        assertThat(script.indexOf("'early'")).isLessThan(script.indexOf("'middle'"));
        assertThat(script.indexOf("'middle'")).isLessThan(script.indexOf("'late'"));

        executeScript(database, script);
        assertThat(queryString(database, "SELECT description FROM event WHERE id = 1")).isEqualTo("early");
    }

    @Test
    void testBookkeepingAndUnknownDirectoriesAreIgnored() throws Exception {
        writeJson(exportDir.resolve("migrations"), "1.json", "{\"version\": 1}");
        writeJson(exportDir.resolve("session"), "1.json", "{\"id\": 1, \"user_id\": 1}");
        writeJson(exportDir.resolve("runner"), "1.json", "{\"id\": 1}");
        writeJson(exportDir.resolve("account"), "1.json", "{\"id\": 1, \"name\": \"Acme\"}");

        MigrationResult result = run(config().build());

        assertThat(result.getProcessingOrder()).containsExactly("account");
        assertThat(result.getScript()).doesNotContain("migrations").doesNotContain("\"session\"");
        assertThat(result.getDiagnostics().getWarnings()).anyMatch(w -> w.contains("runner"));
    }

    @Test
    void testOutputIsDeterministic() throws Exception {
        writeJson(exportDir.resolve("account"), "1.json", "{\"id\": 1, \"name\": \"Acme\"}");
        writeJson(exportDir.resolve("account"), "2.json", "[{\"id\": 2, \"name\": \"Beta\"}, {\"id\": 3, \"name\": \"Gamma\"}]");
        writeJson(exportDir.resolve("project"), "1.json", "{\"id\": 1, \"name\": \"P\", \"account_id\": 3}");

        run(config().build());
        byte[] first = Files.readAllBytes(output);
        run(config().build());
        byte[] second = Files.readAllBytes(output);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void testScriptCanBeAppliedTwice() throws Exception {
        writeJson(exportDir.resolve("account"), "1.json", "{\"id\": 11, \"name\": \"Acme\"}");
        writeJson(exportDir.resolve("account"), "2.json", "{\"id\": 12, \"name\": \"Beta\"}");
        writeJson(exportDir.resolve("project"), "1.json", "{\"id\": 7, \"name\": \"P\", \"account_id\": 12}");

        String script = run(config().build()).getScript();

        executeScript(database, script);
        executeScript(database, script);

        assertThat(count(database, "account")).isEqualTo(2);
        assertThat(count(database, "project")).isEqualTo(1);
        assertThat(queryString(database, "SELECT seq FROM sqlite_sequence WHERE name = 'account'")).isEqualTo("2");
    }

    @Test
    void testRowidAliasSchemaWithoutAutoincrement() throws Exception {
        Path rowidDatabase = createDatabase(tempDir.resolve("rowid.sqlite"),
                "CREATE TABLE account (id INTEGER PRIMARY KEY, name TEXT, visits INTEGER, score REAL)",
                "CREATE TABLE project (id INTEGER PRIMARY KEY, name TEXT, account_id INTEGER REFERENCES account(id))");
        writeJson(exportDir.resolve("account"), "1.json",
                "{\"id\": 5, \"name\": \"A\", \"visits\": \"1e999999999\", \"score\": 1e400}");
        writeJson(exportDir.resolve("account"), "2.json",
                "{\"id\": 6, \"name\": \"B\\u0000C\", \"visits\": 3, \"score\": 2.5}");
        writeJson(exportDir.resolve("project"), "1.json", "{\"id\": 1, \"name\": \"P\", \"account_id\": 6}");

        MigrationResult result = run(config().databasePath(rowidDatabase).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReport().getTotalFallbacks()).isEqualTo(2);
        String script = result.getScript();
        assertThat(script)
                .doesNotContain("sqlite_sequence")
                .contains("DELETE FROM \"account\";")
                .contains("'1e999999999'")
                .contains("'Infinity'");

        executeScript(rowidDatabase, script);
        executeScript(rowidDatabase, script);

        assertThat(count(rowidDatabase, "account")).isEqualTo(2);
        assertThat(count(rowidDatabase, "project")).isEqualTo(1);
        assertThat(queryString(rowidDatabase, "SELECT hex(name) FROM account WHERE id = 2")).isEqualTo("420043");
        assertThat(queryString(rowidDatabase, "SELECT visits FROM account WHERE id = 2")).isEqualTo("3");
        assertThat(queryString(rowidDatabase, "SELECT account_id FROM project WHERE id = 1")).isEqualTo("2");
    }

    @Test
    void testOverflowingNumberIsEmittedAsText() throws Exception {
        writeJson(exportDir.resolve("account"), "1.json", "{\"id\": 1, \"name\": \"Acme\"}");
        writeJson(exportDir.resolve("project"), "1.json", "{\"id\": 1, \"name\": \"P\", \"account_id\": 1}");
        writeJson(exportDir.resolve("event"), "1.json",
                "{\"id\": 1, \"project_id\": 1, \"description\": \"far future\", \"created\": 1e400}");
        writeJson(exportDir.resolve("event"), "2.json",
                "{\"id\": 2, \"project_id\": 1, \"description\": \"now\", \"created\": 1700000000}");

        MigrationResult result = run(config().build());

        assertThat(result.isSuccess()).isTrue();
        TableReport event = result.getReport().getTables().get("event");
        assertThat(event.getRowsEmitted()).isEqualTo(2);
        assertThat(event.getFallbackCoercions()).isEqualTo(1);
        assertThat(result.getDiagnostics().getWarnings()).anyMatch(w -> w.contains("number out of range"));

        executeScript(database, result.getScript());
        assertThat(queryString(database, "SELECT description FROM event WHERE id = 1")).isEqualTo("now");
        assertThat(queryString(database, "SELECT description FROM event WHERE id = 2")).isEqualTo("far future");
    }

    @Test
    void testSurrogateKeysAreContiguous() throws Exception {
        writeJson(exportDir.resolve("account"), "1.json", "{\"id\": 100, \"name\": \"A\"}");
        writeJson(exportDir.resolve("account"), "2.json", "{\"name\": \"no id\"}");
        writeJson(exportDir.resolve("account"), "3.json", "{\"id\": 100, \"name\": \"dup\"}");
        writeJson(exportDir.resolve("account"), "4.json", "{broken");
        writeJson(exportDir.resolve("account"), "5.json", "{\"id\": 250, \"name\": \"B\"}");

        MigrationResult result = run(config().build());

        TableReport account = result.getReport().getTables().get("account");
        assertThat(account.getDocumentsDiscovered()).isEqualTo(5);
        assertThat(account.getRowsEmitted()).isEqualTo(2);
        assertThat(account.getRowsSkipped()).isEqualTo(3);

        executeScript(database, result.getScript());
        assertThat(queryString(database, "SELECT group_concat(id) FROM (SELECT id FROM account ORDER BY id)"))
                .isEqualTo("1,2");
    }

    @Test
    void testDryRunWritesNothing() throws Exception {
        writeJson(exportDir.resolve("account"), "1.json", "{\"id\": 1, \"name\": \"Acme\"}");

        MigrationResult result = run(config().dryRun(true).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutputPath()).isNull();
        assertThat(result.getScript()).contains("INSERT INTO \"account\"");
        assertThat(output).doesNotExist();
    }

    private MigrationConfig.MigrationConfigBuilder config() {
        return MigrationConfig.defaults()
                .databasePath(database)
                .exportDir(exportDir)
                .outputFile(output);
    }

    private static MigrationResult run(MigrationConfig config) {
        return new MigrationRunner(config).run();
    }
}
