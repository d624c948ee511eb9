package com.semaphore.migrator.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the runner. Keeps MigrateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedMigrateOptions {
    Path databasePath;
    Path exportDir;
    Path outputFile;
}
