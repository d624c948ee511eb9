package com.semaphore.migrator.migration.transform.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.semaphore.migrator.migration.catalog.model.RecordGroup;
import com.semaphore.migrator.migration.catalog.model.SourceDocument;
import com.semaphore.migrator.migration.core.context.MigrationDiagnostics;
import com.semaphore.migrator.migration.ordering.MigrationPlan;
import com.semaphore.migrator.migration.registry.IdentifierRegistry;
import com.semaphore.migrator.migration.report.TableReport;
import com.semaphore.migrator.migration.schema.model.TableDefinition;
import com.semaphore.migrator.migration.transform.model.Row;
import com.semaphore.migrator.migration.transform.model.SkipReason;
import com.semaphore.migrator.migration.transform.model.TransformOutcome;

import lombok.RequiredArgsConstructor;

/**
 * Streams the documents of one table through the {@link RecordTransformer}.
 *
 * Rows keep source-discovery order, except that chronological tables are first sorted by their
 * timestamp field, and self-referencing tables defer rows whose parent row has no key yet to a
 * single retry pass over the deferred rows.
 */
@RequiredArgsConstructor
public class TableRecordProcessor {

    private static final Logger log = LoggerFactory.getLogger(TableRecordProcessor.class);

    private final RecordTransformer transformer;

    public void process(TableDefinition table,
                        RecordGroup group,
                        MigrationPlan plan,
                        IdentifierRegistry registry,
                        TableReport report,
                        MigrationDiagnostics diagnostics,
                        Consumer<Row> sink) {
        String tableName = table.getName();

        report.addDiscovered(group.getDocuments().size() + group.getInvalidDocumentCount());
        report.recordSkipped(SkipReason.INVALID_DOCUMENT, group.getInvalidDocumentCount());

        List<SourceDocument> pending = new ArrayList<>(group.getDocuments());
        plan.chronologicalField(tableName).ifPresent(field -> {
            pending.sort(chronologicalOrder(field));
            log.debug("Sorted {} rows of {} by {}", pending.size(), tableName, field);
        });

        boolean selfReferencing = plan.isSelfReferencing(tableName);
        List<SourceDocument> deferred = new ArrayList<>();

        for (SourceDocument document : pending) {
            TransformOutcome outcome = transformer.transform(table, document, registry);
            if (selfReferencing && isUnresolvedSelfReference(outcome, tableName)) {
                deferred.add(document);
                continue;
            }
            accept(outcome, tableName, report, diagnostics, sink);
        }

        if (!deferred.isEmpty()) {
            log.debug("Retrying {} deferred rows of self-referencing table {}", deferred.size(), tableName);
            for (SourceDocument document : deferred) {
                accept(transformer.transform(table, document, registry), tableName, report, diagnostics, sink);
            }
        }

        log.info("Table {}: {} discovered, {} emitted, {} skipped",
                tableName, report.getDocumentsDiscovered(), report.getRowsEmitted(), report.getRowsSkipped());
    }

    private void accept(TransformOutcome outcome,
                        String tableName,
                        TableReport report,
                        MigrationDiagnostics diagnostics,
                        Consumer<Row> sink) {
        if (outcome.isSkipped()) {
            report.recordSkipped(outcome.getSkipReason());
            String msg = String.format("Skipping record in %s (id=%s): %s - %s", tableName,
                    outcome.getOriginalId() == null ? "?" : outcome.getOriginalId(),
                    outcome.getSkipReason().getLabel(), outcome.getDetail());
            diagnostics.getWarnings().add(msg);
            log.warn(msg);
            return;
        }

        for (String warning : outcome.getWarnings()) {
            diagnostics.getWarnings().add("Fallback coercion: " + warning);
            log.warn("Fallback coercion: {}", warning);
        }
        report.recordFallbacks(outcome.getWarnings().size());
        report.recordEmitted();
        sink.accept(outcome.getRow());
    }

    private static boolean isUnresolvedSelfReference(TransformOutcome outcome, String tableName) {
        return outcome.getSkipReason() == SkipReason.MISSING_PARENT
                && tableName.equals(outcome.getReferencedTable());
    }

    /**
     * Missing values first, numbers compared numerically, everything else by text. List.sort is
     * stable, so ties keep discovery order.
     */
    static Comparator<SourceDocument> chronologicalOrder(String field) {
        return (a, b) -> compareValues(a.get(field), b.get(field));
    }

    private static int compareValues(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a.isNumber() && b.isNumber()) {
            if (ValueCoercer.hasExactDecimal(a) && ValueCoercer.hasExactDecimal(b)) {
                return a.decimalValue().compareTo(b.decimalValue());
            }
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return a.asText().compareTo(b.asText());
    }
}
