package com.semaphore.migrator.migration.schema;

/**
 * The destination database could not be opened or its metadata could not be read.
 * Fatal: raised before any source data is processed.
 */
public class SchemaUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaUnavailableException(String message) {
        super(message);
    }

    public SchemaUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
