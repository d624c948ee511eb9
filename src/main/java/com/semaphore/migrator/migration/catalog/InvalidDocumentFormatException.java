package com.semaphore.migrator.migration.catalog;

import java.nio.file.Path;

/**
 * A single export file could not be parsed into documents. Recovered by skipping the file.
 */
public class InvalidDocumentFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Path file;

    public InvalidDocumentFormatException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public InvalidDocumentFormatException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
