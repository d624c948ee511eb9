package com.semaphore.migrator.migration.catalog;

import static com.semaphore.migrator.support.TestFixtures.column;
import static com.semaphore.migrator.support.TestFixtures.surrogateKey;
import static com.semaphore.migrator.support.TestFixtures.writeJson;
import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.semaphore.migrator.migration.catalog.model.RecordGroup;
import com.semaphore.migrator.migration.catalog.service.DocumentReaderService;
import com.semaphore.migrator.migration.catalog.service.SourceCatalogService;
import com.semaphore.migrator.migration.core.context.MigrationDiagnostics;
import com.semaphore.migrator.migration.schema.model.ColumnType;
import com.semaphore.migrator.migration.schema.model.SchemaModel;
import com.semaphore.migrator.migration.schema.model.TableDefinition;

class SourceCatalogServiceTest {

    @TempDir
    Path exportRoot;

    private SourceCatalogService catalog;
    private MigrationDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        SchemaModel schema = new SchemaModel(List.of(
                table("project"),
                table("project_template"),
                table("event"),
                table("migrations"),
                table("session")));
        catalog = new SourceCatalogService(schema, new DocumentReaderService());
        diagnostics = new MigrationDiagnostics();
    }

    @Test
    void testGroupsDirectoriesByResolvedTable() throws Exception {
        writeJson(exportRoot.resolve("project"), "1.json", "{\"id\": 1}");
        writeJson(exportRoot.resolve("project__template_0000000001"), "1.json", "{\"id\": 10}");
        writeJson(exportRoot.resolve("project__template_0000000002"), "1.json", "{\"id\": 20}");

        SortedMap<String, RecordGroup> groups = catalog.discover(exportRoot, Map.of(), diagnostics);

        assertThat(groups).containsOnlyKeys("project", "project_template");
        RecordGroup templates = groups.get("project_template");
        assertThat(templates.getSourceDirectories())
                .containsExactly("project__template_0000000001", "project__template_0000000002");
        assertThat(templates.getDocuments()).extracting(d -> d.get("id").asInt()).containsExactly(10, 20);
    }

    @Test
    void testFilesAreReadInLexicalOrder() throws Exception {
        Path dir = exportRoot.resolve("project");
        writeJson(dir, "b.json", "{\"id\": 2}");
        writeJson(dir, "c.json", "{\"id\": 3}");
        writeJson(dir, "a.json", "{\"id\": 1}");
        writeJson(dir, "notes.txt", "not json");

        RecordGroup group = catalog.discover(exportRoot, Map.of(), diagnostics).get("project");

        assertThat(group.getDocuments()).extracting(d -> d.get("id").asInt()).containsExactly(1, 2, 3);
    }

    @Test
    void testUnknownTableIsWarnedAndExcluded() throws Exception {
        writeJson(exportRoot.resolve("runner"), "1.json", "{\"id\": 1}");

        SortedMap<String, RecordGroup> groups = catalog.discover(exportRoot, Map.of(), diagnostics);

        assertThat(groups).isEmpty();
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("Unknown table 'runner'"));
    }

    @Test
    void testBookkeepingTablesAreExcludedEvenWithOverride() throws Exception {
        writeJson(exportRoot.resolve("migrations"), "1.json", "{\"version\": 1}");
        writeJson(exportRoot.resolve("sessions"), "1.json", "{\"id\": 1}");

        SortedMap<String, RecordGroup> groups = catalog.discover(exportRoot, Map.of("sessions", "session"), diagnostics);

        assertThat(groups).isEmpty();
        assertThat(diagnostics.getWarnings()).isEmpty();
        assertThat(diagnostics.getInfos()).hasSize(2);
    }

    @Test
    void testOverrideMapsDirectoryToTable() throws Exception {
        writeJson(exportRoot.resolve("events"), "1.json", "{\"id\": 1, \"created\": \"2024-01-01\"}");

        SortedMap<String, RecordGroup> groups = catalog.discover(exportRoot, Map.of("events", "event"), diagnostics);

        assertThat(groups).containsOnlyKeys("event");
        assertThat(groups.get("event").getSourceDirectories()).containsExactly("events");
    }

    @Test
    void testRootLevelFileMapsToItsStem() throws Exception {
        writeJson(exportRoot, "project.json", "[{\"id\": 1}, {\"id\": 2}]");

        SortedMap<String, RecordGroup> groups = catalog.discover(exportRoot, Map.of(), diagnostics);

        assertThat(groups.get("project").getDocuments()).hasSize(2);
    }

    @Test
    void testInvalidFileIsCountedAndSkipped() throws Exception {
        Path dir = exportRoot.resolve("project");
        writeJson(dir, "1.json", "{\"id\": 1}");
        writeJson(dir, "2.json", "{broken");

        RecordGroup group = catalog.discover(exportRoot, Map.of(), diagnostics).get("project");

        assertThat(group.getDocuments()).hasSize(1);
        assertThat(group.getInvalidDocumentCount()).isEqualTo(1);
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("2.json"));
    }

    @Test
    void testEmptyDirectoryStillYieldsGroup() throws Exception {
        Files.createDirectories(exportRoot.resolve("project"));

        SortedMap<String, RecordGroup> groups = catalog.discover(exportRoot, Map.of(), diagnostics);

        assertThat(groups.get("project").getDocuments()).isEmpty();
    }

    @Test
    void testUnreadableDirectoryIsWarnedAndExcluded() throws Exception {
        assumeTrue(exportRoot.getFileSystem().supportedFileAttributeViews().contains("posix"));
        writeJson(exportRoot.resolve("event"), "1.json", "{\"id\": 1}");
        Path locked = writeJson(exportRoot.resolve("project"), "1.json", "{\"id\": 2}").getParent();
        Set<PosixFilePermission> original = Files.getPosixFilePermissions(locked);
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            // permissions do not bind a superuser
            assumeFalse(Files.isReadable(locked));

            SortedMap<String, RecordGroup> groups = catalog.discover(exportRoot, Map.of(), diagnostics);

            assertThat(groups).containsOnlyKeys("event");
            assertThat(diagnostics.getWarnings()).anyMatch(w -> w.startsWith("Cannot list") && w.contains("project"));
        } finally {
            Files.setPosixFilePermissions(locked, original);
        }
    }

    @Test
    void testMissingExportRootIsRejected() {
        assertThatThrownBy(() -> catalog.discover(exportRoot.resolve("nope"), Map.of(), diagnostics))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Export directory not found");
    }

    private static TableDefinition table(String name) {
        return TableDefinition.builder()
                .name(name)
                .column(surrogateKey("id"))
                .column(column("name", ColumnType.TEXT))
                .createSql("")
                .build();
    }
}
