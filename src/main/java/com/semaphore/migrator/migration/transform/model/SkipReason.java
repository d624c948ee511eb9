package com.semaphore.migrator.migration.transform.model;

/**
 * Why a source record produced no row. All reasons are recoverable: the record is reported and
 * the run continues.
 */
public enum SkipReason {

    /** The file holding the record could not be parsed. */
    INVALID_DOCUMENT("invalid document format"),

    /** The record lacks the field carrying its own identifier. */
    MISSING_IDENTIFIER("no identifier"),

    /** Another record of the same table already used this identifier. */
    DUPLICATE_IDENTIFIER("duplicate identifier"),

    /** A foreign key points at a parent that has no surrogate key. */
    MISSING_PARENT("missing referenced parent"),

    /** The record carries none of the table's columns. */
    EMPTY_RECORD("no matching columns");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
