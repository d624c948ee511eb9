package com.semaphore.migrator.migration.emit;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.semaphore.migrator.migration.schema.model.TableDefinition;
import com.semaphore.migrator.migration.transform.model.ColumnValue;
import com.semaphore.migrator.migration.transform.model.Row;
import com.semaphore.migrator.migration.transform.model.SqlLiteral;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Serializes rows into SQLite statements and lays out the migration script.
 *
 * The script clears every table that receives rows (data plus, for AUTOINCREMENT tables, its
 * {@code sqlite_sequence} entry) before the first insert, then lists the inserts table by table.
 * Only surrogate keys appear in the output, never source identifiers.
 */
public class StatementEmitter {

    private static final String SCRIPT_TEMPLATE = "migration-script.sql.ftl";

    private final Configuration freemarkerConfig;

    public StatementEmitter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Deletes the table's rows. The {@code sqlite_sequence} entry is reset only for tables declared
     * {@code AUTOINCREMENT}; SQLite creates that table only once such a table exists.
     */
    public List<String> clearingStatements(TableDefinition table) {
        List<String> statements = new ArrayList<>(2);
        statements.add("DELETE FROM " + quoteIdentifier(table.getName()) + ";");
        if (table.declaresAutoincrement()) {
            statements.add("DELETE FROM sqlite_sequence WHERE name = " + SqlLiteral.quote(table.getName()) + ";");
        }
        return statements;
    }

    public String insertStatement(Row row) {
        String columns = row.getValues().stream()
                .map(v -> quoteIdentifier(v.getColumn()))
                .collect(Collectors.joining(", "));
        String values = row.getValues().stream()
                .map(ColumnValue::getLiteral)
                .map(SqlLiteral::getSql)
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + quoteIdentifier(row.getTable()) + " (" + columns + ") VALUES (" + values + ");";
    }

    /**
     * Renders the complete script for the given sections, which must be in resolved order.
     */
    public String render(List<TableSection> sections) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("sections", sections);
        model.put("clearedSections", sections.stream().filter(TableSection::hasRows).toList());

        Template template = freemarkerConfig.getTemplate(SCRIPT_TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + SCRIPT_TEMPLATE + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    /**
     * Double-quoted SQL identifier with embedded double quotes doubled.
     */
    public static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
