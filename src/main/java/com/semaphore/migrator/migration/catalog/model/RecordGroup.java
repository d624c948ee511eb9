package com.semaphore.migrator.migration.catalog.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * All source documents destined for one table, in discovery order.
 */
@Getter
public class RecordGroup {

    private final String tableName;
    private final List<String> sourceDirectories = new ArrayList<>();
    private final List<SourceDocument> documents = new ArrayList<>();
    private int invalidDocumentCount;

    public RecordGroup(String tableName) {
        this.tableName = tableName;
    }

    public void addSource(String directoryName) {
        sourceDirectories.add(directoryName);
    }

    public void addDocuments(List<SourceDocument> docs) {
        documents.addAll(docs);
    }

    public void recordInvalidDocument() {
        invalidDocumentCount++;
    }

    public List<SourceDocument> getDocuments() {
        return Collections.unmodifiableList(documents);
    }

    public List<String> getSourceDirectories() {
        return Collections.unmodifiableList(sourceDirectories);
    }
}
