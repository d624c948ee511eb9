package com.semaphore.migrator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.semaphore.migrator.cli.exception.OptionsValidationException;
import com.semaphore.migrator.cli.model.MigrateOptions;
import com.semaphore.migrator.cli.model.ValidatedMigrateOptions;

public class MigrateOptionsValidator {

	public ValidatedMigrateOptions validate(MigrateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getDatabase() == null || !Files.isRegularFile(o.getDatabase())) {
			errors.add("Destination database does not exist: " + o.getDatabase());
		}

		if (o.getExportDir() == null || !Files.isDirectory(o.getExportDir())) {
			errors.add("Export directory does not exist or is not a directory: " + o.getExportDir());
		}

		if (o.getOutput() == null) {
			errors.add("Output file is required (--output / -o).");
		} else if (Files.isDirectory(o.getOutput())) {
			errors.add("Output path is a directory: " + o.getOutput());
		}

		validateMapping("--table-override", o.getTableOverrides(), errors);
		validateMapping("--chronological-table", o.getChronologicalTables(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedMigrateOptions(
				normalize(o.getDatabase()),
				normalize(o.getExportDir()),
				normalize(o.getOutput()));
	}

	private static void validateMapping(String option, Map<String, String> mapping, List<String> errors) {
		if (mapping == null) {
			return;
		}
		mapping.forEach((key, value) -> {
			if (isBlank(key) || isBlank(value)) {
				errors.add(option + " entries must look like NAME=VALUE. Got: " + key + "=" + value);
			}
		});
	}

	private static Path normalize(Path p) {
		return p.toAbsolutePath().normalize();
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
