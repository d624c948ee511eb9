package com.semaphore.migrator.cli.output;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semaphore.migrator.cli.model.MigrateOptions;
import com.semaphore.migrator.cli.model.ValidatedMigrateOptions;
import com.semaphore.migrator.migration.MigrationResult;
import com.semaphore.migrator.migration.report.TableReport;
import com.semaphore.migrator.migration.schema.model.ForeignKeyDefinition;
import com.semaphore.migrator.migration.schema.model.SchemaModel;

/**
 * Responsible only for printing CLI output for the "migrate" command.
 * No validation, no execution.
 */
public class MigrateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(MigrateResultsPrinter.class);

    public void printBanner(MigrateOptions o, ValidatedMigrateOptions v) {
        log.info("=================================================");
        log.info("Semaphore Data Migration Tool");
        log.info("=================================================");
        log.info("Database: {}", v.getDatabasePath());
        log.info("Export Directory: {}", v.getExportDir());
        log.info("Output File: {}", o.isDryRun() ? "None (dry run)" : v.getOutputFile());
        log.info("Table Overrides: {}", o.getTableOverrides().isEmpty() ? "None" : o.getTableOverrides());
        log.info("Chronological Tables: {}", o.getChronologicalTables());
        log.info("=================================================");
    }

    public void printRelationships(SchemaModel schema) {
        log.info("Database Table Relationships Summary:");
        log.info("-----------------------------------");
        Map<String, List<ForeignKeyDefinition>> relationships = schema.relationships();
        if (relationships.isEmpty()) {
            log.info("No foreign key relationships found.");
        }
        relationships.forEach((table, fks) -> {
            log.info("Table: {}", table);
            for (ForeignKeyDefinition fk : fks) {
                log.info("  - {} references {}.{}", fk.getColumn(), fk.getReferencedTable(), fk.getReferencedColumn());
            }
        });
        log.info("-----------------------------------");
    }

    public void printSuccess(MigrationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("MIGRATION COMPLETE");
        log.info("=================================================");
        log.info("Processing Order: {}", String.join(", ", result.getProcessingOrder()));
        log.info("");
        log.info("Rows per table:");
        for (TableReport table : result.getReport().getTables().values()) {
            log.info("  {}: {} discovered, {} emitted, {} skipped{}",
                    table.getTableName(),
                    table.getDocumentsDiscovered(),
                    table.getRowsEmitted(),
                    table.getRowsSkipped(),
                    formatSkipReasons(table));
            if (table.getFallbackCoercions() > 0) {
                log.info("      {} value(s) emitted as text after failed coercion", table.getFallbackCoercions());
            }
        }
        log.info("");
        log.info("Totals: {} discovered, {} emitted, {} skipped, {} emitted as text",
                result.getReport().getTotalDiscovered(),
                result.getReport().getTotalEmitted(),
                result.getReport().getTotalSkipped(),
                result.getReport().getTotalFallbacks());
        if (result.getDiagnostics().hasWarnings()) {
            log.warn("Warnings: {} (see log above)", result.getDiagnostics().getWarnings().size());
        }
        log.info("Statements: {}", result.getStatementCount());
        if (result.getOutputPath() != null) {
            log.info("SQL file has been saved to: {}", result.getOutputPath());
        }
        log.info("=================================================");
    }

    public void printFailure(MigrationResult result) {
        log.error("=================================================");
        log.error("MIGRATION FAILED - no output written");
        log.error("=================================================");
        if (result.getDiagnostics() != null && result.getDiagnostics().hasErrors()) {
            result.getDiagnostics().getErrors().forEach(err -> log.error("Details: {}", err));
        } else {
            log.error("Details: {}", result.getErrorMessage());
        }
    }

    private static String formatSkipReasons(TableReport table) {
        if (table.getSkipped().isEmpty()) {
            return "";
        }
        return table.getSkipped().entrySet().stream()
                .map(e -> e.getKey().getLabel() + ": " + e.getValue())
                .collect(Collectors.joining(", ", " (", ")"));
    }
}
