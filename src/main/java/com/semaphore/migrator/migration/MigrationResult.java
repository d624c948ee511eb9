package com.semaphore.migrator.migration;

import java.nio.file.Path;
import java.util.List;

import com.semaphore.migrator.migration.core.context.MigrationDiagnostics;
import com.semaphore.migrator.migration.report.MigrationReport;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a migration run.
 */
@Data
@Builder
public class MigrationResult {
    private boolean success;
    private String errorMessage;

    /**
     * Written script, {@code null} on failure or dry run.
     */
    private Path outputPath;

    /**
     * The rendered script; empty on failure.
     */
    private String script;

    private List<String> processingOrder;
    private int statementCount;
    private MigrationReport report;
    private MigrationDiagnostics diagnostics;

    public static MigrationResult failure(String errorMessage, MigrationDiagnostics diagnostics) {
        return MigrationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .script("")
                .processingOrder(List.of())
                .report(new MigrationReport())
                .diagnostics(diagnostics)
                .build();
    }
}
