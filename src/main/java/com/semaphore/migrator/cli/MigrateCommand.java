package com.semaphore.migrator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semaphore.migrator.cli.exception.OptionsValidationException;
import com.semaphore.migrator.cli.model.MigrateOptions;
import com.semaphore.migrator.cli.model.ValidatedMigrateOptions;
import com.semaphore.migrator.cli.output.MigrateResultsPrinter;
import com.semaphore.migrator.cli.validation.MigrateOptionsValidator;
import com.semaphore.migrator.migration.MigrationResult;
import com.semaphore.migrator.migration.MigrationRunner;
import com.semaphore.migrator.migration.core.context.MigrationConfig;
import com.semaphore.migrator.migration.core.context.MigrationDiagnostics;
import com.semaphore.migrator.migration.schema.SchemaUnavailableException;
import com.semaphore.migrator.migration.schema.service.SchemaLoaderService;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that migrates a key-value export into an SQL script for an existing SQLite schema.
 */
@Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        version = "semaphore-sql-migrator 1.0.0",
        description = "Generates SQL statements that load a JSON key-value export into an existing SQLite schema, re-keying all records."
)
public class MigrateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MigrateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private MigrateOptions options = new MigrateOptions();

    private final MigrateOptionsValidator validator = new MigrateOptionsValidator();
    private final MigrateResultsPrinter printer = new MigrateResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedMigrateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(err -> log.error("Invalid option: {}", err));
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        if (options.isShowRelationships()) {
            try {
                printer.printRelationships(new SchemaLoaderService()
                        .load(validated.getDatabasePath(), new MigrationDiagnostics()));
            } catch (SchemaUnavailableException e) {
                log.error("Cannot read schema: {}", e.getMessage());
                return EXIT_FAILED;
            }
        }

        MigrationConfig config = MigrationConfig.builder()
                .databasePath(validated.getDatabasePath())
                .exportDir(validated.getExportDir())
                .outputFile(validated.getOutputFile())
                .tableNameOverrides(options.getTableOverrides())
                .chronologicalTables(options.getChronologicalTables())
                .dryRun(options.isDryRun())
                .build();

        MigrationResult result = new MigrationRunner(config).run();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FAILED;
        }

        printer.printSuccess(result);
        return EXIT_OK;
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger appLogger = LoggerFactory.getLogger("com.semaphore.migrator");
        if (appLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
