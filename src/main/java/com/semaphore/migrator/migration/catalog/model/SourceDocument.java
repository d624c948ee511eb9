package com.semaphore.migrator.migration.catalog.model;

import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.Value;

/**
 * One exported record: the JSON object plus where it came from.
 */
@Value
public class SourceDocument {

    Path sourceFile;

    /**
     * Position of the record inside its file; always 0 unless the file holds an array.
     */
    int index;

    ObjectNode fields;

    /**
     * Field value, or {@code null} when the field is absent or explicitly null.
     */
    public JsonNode get(String field) {
        JsonNode node = fields.get(field);
        return node == null || node.isNull() ? null : node;
    }

    public boolean has(String field) {
        return fields.has(field);
    }

    public String describe() {
        return index == 0 ? sourceFile.getFileName().toString()
                : sourceFile.getFileName() + "[" + index + "]";
    }
}
