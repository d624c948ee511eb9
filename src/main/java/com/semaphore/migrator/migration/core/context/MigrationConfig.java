package com.semaphore.migrator.migration.core.context;

import java.nio.file.Path;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for a single migration run.
 */
@Data
@Builder
public class MigrationConfig {

    public static final String DEFAULT_DATABASE = "database.sqlite";
    public static final String DEFAULT_EXPORT_DIR = "export";
    public static final String DEFAULT_OUTPUT_FILE = "migrated_data.sql";

    /**
     * Destination SQLite database, opened read-only for schema discovery.
     */
    private Path databasePath;

    /**
     * Root of the key-value export: one subdirectory per record group.
     */
    private Path exportDir;

    /**
     * Script written at the end of a successful run.
     */
    private Path outputFile;

    /**
     * Export directory name to destination table name.
     */
    @Singular
    private Map<String, String> tableNameOverrides;

    /**
     * Append-only log tables whose rows are emitted sorted by the mapped timestamp field.
     */
    @Singular
    private Map<String, String> chronologicalTables;

    /**
     * Run the whole pipeline but do not write the script.
     */
    private boolean dryRun;

    public static MigrationConfigBuilder defaults() {
        return MigrationConfig.builder()
                .databasePath(Path.of(DEFAULT_DATABASE))
                .exportDir(Path.of(DEFAULT_EXPORT_DIR))
                .outputFile(Path.of(DEFAULT_OUTPUT_FILE))
                .chronologicalTable("event", "created");
    }
}
