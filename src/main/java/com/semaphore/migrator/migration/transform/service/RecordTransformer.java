package com.semaphore.migrator.migration.transform.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.semaphore.migrator.migration.catalog.model.SourceDocument;
import com.semaphore.migrator.migration.registry.IdentifierRegistry;
import com.semaphore.migrator.migration.schema.model.ColumnDefinition;
import com.semaphore.migrator.migration.schema.model.ForeignKeyDefinition;
import com.semaphore.migrator.migration.schema.model.SchemaModel;
import com.semaphore.migrator.migration.schema.model.TableDefinition;
import com.semaphore.migrator.migration.transform.model.CoercionResult;
import com.semaphore.migrator.migration.transform.model.ColumnValue;
import com.semaphore.migrator.migration.transform.model.Row;
import com.semaphore.migrator.migration.transform.model.SkipReason;
import com.semaphore.migrator.migration.transform.model.SqlLiteral;
import com.semaphore.migrator.migration.transform.model.TransformOutcome;

import lombok.RequiredArgsConstructor;

/**
 * Turns one source document into a typed {@link Row} for its destination table.
 *
 * <ul>
 *   <li>The surrogate key column of a tracked table receives the key the registry assigns to the
 *       document's own identifier.</li>
 *   <li>A foreign key to a tracked table's surrogate key is rewritten to the parent's new key; an
 *       unknown parent skips the record.</li>
 *   <li>Every other column is coerced by {@link ValueCoercer}.</li>
 * </ul>
 *
 * The registry is only advanced once every reference of the record resolved, so skipped records
 * never consume a key.
 */
@RequiredArgsConstructor
public class RecordTransformer {

    private final SchemaModel schema;
    private final ValueCoercer coercer;

    public TransformOutcome transform(TableDefinition table, SourceDocument document, IdentifierRegistry registry) {
        String tableName = table.getName();
        ColumnDefinition keyColumn = registry.isTracked(tableName)
                ? table.getSurrogateKeyColumn().orElse(null)
                : null;

        String originalId = null;
        if (keyColumn != null) {
            originalId = identifierText(document.get(keyColumn.getName()));
            if (originalId == null) {
                return TransformOutcome.skip(SkipReason.MISSING_IDENTIFIER, null,
                        "no '" + keyColumn.getName() + "' field in " + document.describe());
            }
            if (registry.lookup(tableName, originalId).isPresent()) {
                return TransformOutcome.skip(SkipReason.DUPLICATE_IDENTIFIER, originalId,
                        "identifier already migrated, " + document.describe());
            }
        }

        List<ColumnValue> values = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean anyColumnPresent = false;
        int keyIndex = -1;

        for (ColumnDefinition column : table.getColumns()) {
            String name = column.getName();
            boolean present = document.has(name);
            anyColumnPresent |= present;

            if (column == keyColumn) {
                keyIndex = values.size();
                values.add(null);
                continue;
            }

            if (!present && column.isNotNull() && column.hasDefaultValue()) {
                // leave the column out so the declared default applies
                continue;
            }

            JsonNode value = document.get(name);
            Optional<ForeignKeyDefinition> fk = table.getForeignKeyFor(name);

            if (fk.isPresent() && isRekeyedReference(fk.get(), registry)) {
                if (value == null) {
                    values.add(new ColumnValue(name, SqlLiteral.nullValue()));
                    continue;
                }
                String parentId = identifierText(value);
                Optional<Long> parentKey = registry.lookup(fk.get().getReferencedTable(), parentId);
                if (parentKey.isEmpty()) {
                    return TransformOutcome.builder()
                            .skipReason(SkipReason.MISSING_PARENT)
                            .originalId(originalId)
                            .referencedTable(fk.get().getReferencedTable())
                            .detail(String.format("%s=%s not found in %s, %s", name, value.asText(),
                                    fk.get().getReferencedTable(), document.describe()))
                            .build();
                }
                values.add(new ColumnValue(name, SqlLiteral.ofInteger(parentKey.get())));
                continue;
            }

            CoercionResult result = coercer.coerce(column, value);
            if (result.isFallback()) {
                warnings.add(tableName + "." + result.getFallbackReason() + " (" + document.describe() + ")");
            }
            values.add(new ColumnValue(name, result.getLiteral()));
        }

        if (!anyColumnPresent) {
            return TransformOutcome.skip(SkipReason.EMPTY_RECORD, originalId,
                    "no column of " + tableName + " in " + document.describe());
        }

        if (keyColumn != null) {
            long key = registry.assign(tableName, originalId);
            values.set(keyIndex, new ColumnValue(keyColumn.getName(), SqlLiteral.ofInteger(key)));
        }

        return TransformOutcome.builder()
                .row(new Row(tableName, values))
                .originalId(originalId)
                .warnings(warnings)
                .build();
    }

    /**
     * True when the foreign key points at the surrogate key of a table re-keyed in this run.
     */
    private boolean isRekeyedReference(ForeignKeyDefinition fk, IdentifierRegistry registry) {
        if (!registry.isTracked(fk.getReferencedTable())) {
            return false;
        }
        return schema.getTable(fk.getReferencedTable())
                .flatMap(TableDefinition::getSurrogateKeyColumn)
                .map(pk -> pk.getName().equals(fk.getReferencedColumn()))
                .orElse(false);
    }

    /**
     * Identifier of a record as the registry sees it; {@code null} when absent, blank or structured.
     */
    static String identifierText(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
