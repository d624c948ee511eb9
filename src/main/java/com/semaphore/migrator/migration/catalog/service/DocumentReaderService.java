package com.semaphore.migrator.migration.catalog.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semaphore.migrator.migration.catalog.InvalidDocumentFormatException;
import com.semaphore.migrator.migration.catalog.model.SourceDocument;

/**
 * Parses one export file. A file holds either a single JSON object or an array of objects.
 */
public class DocumentReaderService {

    private final ObjectMapper objectMapper;

    public DocumentReaderService() {
        this(new ObjectMapper());
    }

    public DocumentReaderService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<SourceDocument> read(Path file) throws InvalidDocumentFormatException, IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new InvalidDocumentFormatException(file,
                    "Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        }

        if (root == null || root.isMissingNode()) {
            throw new InvalidDocumentFormatException(file, "Empty document: " + file);
        }

        List<SourceDocument> documents = new ArrayList<>();
        if (root.isObject()) {
            documents.add(new SourceDocument(file, 0, (ObjectNode) root));
        } else if (root.isArray()) {
            int index = 0;
            for (JsonNode element : root) {
                if (!element.isObject()) {
                    throw new InvalidDocumentFormatException(file,
                            "Array element " + index + " of " + file + " is not an object");
                }
                documents.add(new SourceDocument(file, index++, (ObjectNode) element));
            }
        } else {
            throw new InvalidDocumentFormatException(file,
                    "Expected a JSON object or array in " + file + ", found " + root.getNodeType());
        }
        return documents;
    }
}
