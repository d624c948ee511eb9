package com.semaphore.migrator.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semaphore.migrator.migration.catalog.model.RecordGroup;
import com.semaphore.migrator.migration.catalog.service.DocumentReaderService;
import com.semaphore.migrator.migration.catalog.service.SourceCatalogService;
import com.semaphore.migrator.migration.core.context.MigrationConfig;
import com.semaphore.migrator.migration.core.context.MigrationDiagnostics;
import com.semaphore.migrator.migration.emit.StatementEmitter;
import com.semaphore.migrator.migration.emit.TableSection;
import com.semaphore.migrator.migration.ordering.CyclicDependencyException;
import com.semaphore.migrator.migration.ordering.DependencyGraph;
import com.semaphore.migrator.migration.ordering.DependencyResolverService;
import com.semaphore.migrator.migration.ordering.MigrationPlan;
import com.semaphore.migrator.migration.registry.IdentifierRegistry;
import com.semaphore.migrator.migration.report.MigrationReport;
import com.semaphore.migrator.migration.schema.SchemaUnavailableException;
import com.semaphore.migrator.migration.schema.model.SchemaModel;
import com.semaphore.migrator.migration.schema.model.TableDefinition;
import com.semaphore.migrator.migration.schema.service.SchemaLoaderService;
import com.semaphore.migrator.migration.transform.service.RecordTransformer;
import com.semaphore.migrator.migration.transform.service.TableRecordProcessor;
import com.semaphore.migrator.migration.transform.service.ValueCoercer;
import com.semaphore.migrator.util.FileWriteUtil;

/**
 * Runs the whole migration: schema load, catalog discovery, dependency ordering, per-table
 * transformation and script emission.
 *
 * Structural failures (unreadable schema, cyclic references) abort before anything is written;
 * per-record problems are skipped and counted. The script is written only once every table has
 * been processed.
 */
public class MigrationRunner {
    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final MigrationConfig config;
    private final SchemaLoaderService schemaLoader;
    private final DependencyResolverService dependencyResolver;
    private final StatementEmitter emitter;

    public MigrationRunner(MigrationConfig config) {
        this(config, new SchemaLoaderService(), new DependencyResolverService(), new StatementEmitter());
    }

    public MigrationRunner(MigrationConfig config,
                           SchemaLoaderService schemaLoader,
                           DependencyResolverService dependencyResolver,
                           StatementEmitter emitter) {
        this.config = config;
        this.schemaLoader = schemaLoader;
        this.dependencyResolver = dependencyResolver;
        this.emitter = emitter;
    }

    public MigrationResult run() {
        MigrationDiagnostics diagnostics = new MigrationDiagnostics();
        try {
            log.info("Starting migration...");

            log.info("Step 1: Reading database schema...");
            SchemaModel schema = schemaLoader.load(config.getDatabasePath(), diagnostics);

            log.info("Step 2: Analyzing export directory structure...");
            SourceCatalogService catalog = new SourceCatalogService(schema, new DocumentReaderService());
            SortedMap<String, RecordGroup> groups =
                    catalog.discover(config.getExportDir(), config.getTableNameOverrides(), diagnostics);

            log.info("Step 3: Resolving table dependencies...");
            MigrationPlan plan = dependencyResolver.plan(groups.keySet(),
                    DependencyGraph.fromSchema(schema), config.getChronologicalTables());

            log.info("Step 4: Transforming records...");
            MigrationReport report = new MigrationReport();
            List<TableSection> sections = transformAll(schema, groups, plan, report, diagnostics);

            log.info("Step 5: Rendering SQL script...");
            String script = emitter.render(sections);
            int statementCount = sections.stream()
                    .mapToInt(s -> s.getClearStatements().size() + s.getInsertStatements().size())
                    .sum();

            if (config.isDryRun()) {
                log.info("Dry run: script not written ({} statements)", statementCount);
            } else {
                FileWriteUtil.safeWriteString(config.getOutputFile(), script);
                log.info("SQL statements have been written to {}", config.getOutputFile());
            }

            return MigrationResult.builder()
                    .success(true)
                    .outputPath(config.isDryRun() ? null : config.getOutputFile())
                    .script(script)
                    .processingOrder(plan.getOrderedTables())
                    .statementCount(statementCount)
                    .report(report)
                    .diagnostics(diagnostics)
                    .build();

        } catch (SchemaUnavailableException | CyclicDependencyException e) {
            diagnostics.getErrors().add(e.getMessage());
            log.error("Migration aborted: {}", e.getMessage());
            return MigrationResult.failure(e.getMessage(), diagnostics);
        } catch (Exception e) {
            diagnostics.getErrors().add(String.valueOf(e.getMessage()));
            log.error("Migration failed", e);
            return MigrationResult.failure(e.getMessage(), diagnostics);
        }
    }

    private List<TableSection> transformAll(SchemaModel schema,
                                            SortedMap<String, RecordGroup> groups,
                                            MigrationPlan plan,
                                            MigrationReport report,
                                            MigrationDiagnostics diagnostics) {
        IdentifierRegistry registry = new IdentifierRegistry();
        for (String table : plan.getOrderedTables()) {
            if (schema.requireTable(table).isSurrogateKeyed()) {
                registry.track(table);
            }
        }

        TableRecordProcessor processor =
                new TableRecordProcessor(new RecordTransformer(schema, new ValueCoercer()));

        List<TableSection> sections = new ArrayList<>();
        for (String tableName : plan.getOrderedTables()) {
            TableDefinition table = schema.requireTable(tableName);
            TableSection.TableSectionBuilder section = TableSection.builder()
                    .tableName(tableName)
                    .note(plan.chronologicalField(tableName).map(f -> "sorted by " + f).orElse(null));

            List<String> inserts = new ArrayList<>();
            processor.process(table, groups.get(tableName), plan, registry, report.table(tableName),
                    diagnostics, row -> inserts.add(emitter.insertStatement(row)));

            if (!inserts.isEmpty()) {
                section.clearStatements(emitter.clearingStatements(table));
            }
            sections.add(section.insertStatements(inserts).build());
        }
        return sections;
    }
}
