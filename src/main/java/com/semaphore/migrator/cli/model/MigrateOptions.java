package com.semaphore.migrator.cli.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "migrate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class MigrateOptions {

	@Option(names = { "--database", "-d" }, defaultValue = "database.sqlite",
			description = "Destination SQLite database whose schema is already applied (default: ${DEFAULT-VALUE})")
	private Path database;

	@Option(names = { "--export-dir", "-e" }, defaultValue = "export",
			description = "Root directory of the key-value export (default: ${DEFAULT-VALUE})")
	private Path exportDir;

	@Option(names = { "--output", "-o" }, defaultValue = "migrated_data.sql",
			description = "SQL script to write (default: ${DEFAULT-VALUE})")
	private Path output;

	@Option(names = { "--table-override" }, paramLabel = "DIR=TABLE",
			description = "Maps an export directory to a destination table, e.g. events=event (repeatable)")
	private Map<String, String> tableOverrides = new LinkedHashMap<>();

	@Option(names = { "--chronological-table" }, paramLabel = "TABLE=FIELD",
			description = "Emits the rows of TABLE sorted by FIELD (repeatable, default: event=created)")
	private Map<String, String> chronologicalTables;

	@Option(names = { "--show-relationships" }, description = "Log the foreign key relationships of the schema")
	private boolean showRelationships;

	@Option(names = { "--dry-run" }, description = "Run the migration without writing the script")
	private boolean dryRun;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

	public Map<String, String> getChronologicalTables() {
		return chronologicalTables == null ? Map.of("event", "created") : chronologicalTables;
	}
}
