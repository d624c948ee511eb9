package com.semaphore.migrator;

import com.semaphore.migrator.cli.MigrateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Semaphore data migration tool.
 * Reads a key-value JSON export and writes an SQL script that loads it into an existing
 * SQLite schema with freshly assigned surrogate keys.
 */
public class MigratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MigrateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
