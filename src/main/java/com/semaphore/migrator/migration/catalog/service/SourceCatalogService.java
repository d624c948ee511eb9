package com.semaphore.migrator.migration.catalog.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semaphore.migrator.migration.catalog.InvalidDocumentFormatException;
import com.semaphore.migrator.migration.catalog.model.RecordGroup;
import com.semaphore.migrator.migration.core.context.MigrationDiagnostics;
import com.semaphore.migrator.migration.schema.model.SchemaModel;

import lombok.RequiredArgsConstructor;

/**
 * Discovers the record groups of an export tree and the destination table each one feeds.
 *
 * Entries of the export root are visited in lexical name order, and the files of a directory in
 * lexical file-name order, so several directories resolving to the same table are concatenated
 * deterministically.
 */
@RequiredArgsConstructor
public class SourceCatalogService {

    private static final Logger log = LoggerFactory.getLogger(SourceCatalogService.class);

    private static final String JSON_EXTENSION = ".json";

    private final SchemaModel schema;
    private final DocumentReaderService documentReader;

    public SortedMap<String, RecordGroup> discover(Path exportRoot,
                                                   Map<String, String> tableNameOverrides,
                                                   MigrationDiagnostics diagnostics) {
        if (exportRoot == null || !Files.isDirectory(exportRoot)) {
            throw new IllegalArgumentException("Export directory not found: " + exportRoot);
        }

        TableNameResolver resolver = new TableNameResolver(tableNameOverrides);
        SortedMap<String, RecordGroup> groups = new TreeMap<>();

        List<Path> entries;
        try {
            entries = listSorted(exportRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list export directory " + exportRoot, e);
        }

        for (Path entry : entries) {
            String entryName = entry.getFileName().toString();

            if (Files.isDirectory(entry)) {
                String table = acceptTable(resolver.resolve(entryName), entryName, diagnostics);
                List<Path> files = table == null ? null : listDirectory(entry, diagnostics);
                if (files != null) {
                    RecordGroup group = groups.computeIfAbsent(table, RecordGroup::new);
                    group.addSource(entryName);
                    for (Path file : files) {
                        if (isJsonFile(file)) {
                            readInto(group, file, diagnostics);
                        } else {
                            log.debug("Ignoring non-JSON entry {}", file);
                        }
                    }
                }
            } else if (isJsonFile(entry)) {
                // JSON files directly under the root are named after their table
                String stem = entryName.substring(0, entryName.length() - JSON_EXTENSION.length());
                String table = acceptTable(resolver.resolve(stem), entryName, diagnostics);
                if (table != null) {
                    RecordGroup group = groups.computeIfAbsent(table, RecordGroup::new);
                    group.addSource(entryName);
                    readInto(group, entry, diagnostics);
                }
            }
        }

        groups.values().forEach(g -> log.info("Record group {}: {} documents from {}",
                g.getTableName(), g.getDocuments().size(), g.getSourceDirectories()));
        return groups;
    }

    private String acceptTable(String table, String entryName, MigrationDiagnostics diagnostics) {
        if (TableNameResolver.isExcluded(table)) {
            diagnostics.getInfos().add("Skipping bookkeeping table '" + table + "' (from " + entryName + ")");
            log.debug("Skipping bookkeeping table {} (from {})", table, entryName);
            return null;
        }
        if (!schema.hasTable(table)) {
            String msg = String.format("Unknown table '%s' for export entry '%s'; entry excluded", table, entryName);
            diagnostics.getWarnings().add(msg);
            log.warn(msg);
            return null;
        }
        return table;
    }

    private void readInto(RecordGroup group, Path file, MigrationDiagnostics diagnostics) {
        try {
            group.addDocuments(documentReader.read(file));
        } catch (InvalidDocumentFormatException e) {
            group.recordInvalidDocument();
            diagnostics.getWarnings().add(e.getMessage());
            log.warn("Skipping file: {}", e.getMessage());
        } catch (IOException e) {
            group.recordInvalidDocument();
            String msg = "Cannot read " + file + ": " + e.getMessage();
            diagnostics.getWarnings().add(msg);
            log.warn("Skipping file: {}", msg);
        }
    }

    /**
     * Directory entries in lexical order, or {@code null} when the directory cannot be listed.
     */
    private static List<Path> listDirectory(Path dir, MigrationDiagnostics diagnostics) {
        try {
            return listSorted(dir);
        } catch (IOException e) {
            String msg = "Cannot list " + dir + ": " + e.getMessage() + "; entry excluded";
            diagnostics.getWarnings().add(msg);
            log.warn(msg);
            return null;
        }
    }

    private static List<Path> listSorted(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private static boolean isJsonFile(Path path) {
        return Files.isRegularFile(path)
                && path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(JSON_EXTENSION);
    }
}
