package org.carball.probe.analysis;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.binding.BindingResult;
import org.carball.probe.binding.CategoryRegistry;
import org.carball.probe.binding.ResultBinder;
import org.carball.probe.config.ProbeSettings;
import org.carball.probe.config.QueryCatalog;
import org.carball.probe.config.QueryDefinition;
import org.carball.probe.config.QueryTemplateFormatter;
import org.carball.probe.connection.SqlConnection;
import org.carball.probe.exception.UnknownCategoryException;
import org.carball.probe.ingest.BatchedIngestionAdapter;
import org.carball.probe.ingest.InstanceIdentity;
import org.carball.probe.ingest.TelemetrySink;
import org.carball.probe.model.CandidateRecord;
import org.carball.probe.model.ExecutionPlanRecord;
import org.carball.probe.model.RawRow;
import org.carball.probe.model.RecordCategory;
import org.carball.probe.model.ValidationResult;
import org.carball.probe.retry.RetryExecutor;
import org.carball.probe.retry.RetryPolicy;
import org.carball.probe.selection.SelectionEngine;
import org.carball.probe.selection.SelectionOutcome;
import org.carball.probe.validation.PreconditionValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one analysis cycle: validate the instance, then run each query definition through
 * execute, bind, select, fetch plans and ingest.
 *
 * <p>A validation rejection aborts the cycle. Any other failure is confined to the definition it
 * happened in.
 */
@Slf4j
public class QueryAnalysisOrchestrator {

    private final SqlConnection connection;
    private final ProbeSettings settings;
    private final QueryCatalog catalog;
    private final PreconditionValidator validator;
    private final CategoryRegistry registry;
    private final ResultBinder resultBinder;
    private final SelectionEngine selectionEngine;
    private final RetryExecutor retryExecutor;
    private final BatchedIngestionAdapter ingestionAdapter;
    private final ExecutionPlanFetcher planFetcher;

    private volatile AnalysisState state = AnalysisState.IDLE;

    public QueryAnalysisOrchestrator(SqlConnection connection, ProbeSettings settings, QueryCatalog catalog,
                                     PreconditionValidator validator, CategoryRegistry registry,
                                     BatchedIngestionAdapter ingestionAdapter) {
        this.connection = connection;
        this.settings = settings;
        this.catalog = catalog;
        this.validator = validator;
        this.registry = registry;
        this.resultBinder = new ResultBinder(registry);
        this.selectionEngine = new SelectionEngine(settings.getSelectionAlgorithm());
        this.retryExecutor = new RetryExecutor(new RetryPolicy(settings.getRetryAttempts()));
        this.ingestionAdapter = ingestionAdapter;
        this.planFetcher = new ExecutionPlanFetcher(connection, settings, catalog.executionPlanQuery(),
                resultBinder, retryExecutor);
    }

    /**
     * Wires the default registry and a batched adapter over {@code sink}.
     */
    public static QueryAnalysisOrchestrator create(SqlConnection connection, ProbeSettings settings,
                                                   QueryCatalog catalog, PreconditionValidator validator,
                                                   TelemetrySink sink) {
        BatchedIngestionAdapter adapter = new BatchedIngestionAdapter(sink,
                InstanceIdentity.resolve(connection), settings.getBatchSize());
        return new QueryAnalysisOrchestrator(connection, settings, catalog, validator,
                CategoryRegistry.defaults(), adapter);
    }

    public CycleReport runCycle() {
        log.info("Starting query analysis cycle ({} definitions)", catalog.definitions().size());
        state = AnalysisState.VALIDATING;
        ValidationResult validation = validator.check(connection, settings.isLegacyMode());
        if (!validation.passed()) {
            log.error("Query analysis disabled for this cycle: {}", validation.describeFailures());
            state = AnalysisState.IDLE;
            return CycleReport.rejected(validation);
        }

        List<DefinitionReport> reports = new ArrayList<>();
        try {
            for (QueryDefinition definition : catalog.definitions()) {
                reports.add(runDefinition(definition));
            }
        } finally {
            state = AnalysisState.IDLE;
        }

        CycleReport report = new CycleReport(validation, reports);
        log.info("Query analysis cycle finished: {}", report.getSummary());
        return report;
    }

    DefinitionReport runDefinition(QueryDefinition definition) {
        RecordCategory category;
        try {
            category = RecordCategory.fromIdentifier(definition.type());
            registry.binderFor(category);
        } catch (UnknownCategoryException e) {
            log.error("Skipping {}: {}", definition.eventName(), e.getMessage());
            return DefinitionReport.skipped(definition, e.getMessage());
        }

        try {
            state = AnalysisState.EXECUTING;
            String sql = QueryTemplateFormatter.format(definition.query(), QueryTemplateFormatter.valuesFor(settings));
            List<RawRow> rows = retryExecutor.execute("Query " + definition.eventName(), () -> connection.query(sql));
            log.debug("{} returned {} rows", definition.eventName(), rows.size());

            state = AnalysisState.BINDING;
            BindingResult bound = resultBinder.bind(category, rows);

            List<CandidateRecord> toIngest = bound.records();
            List<ExecutionPlanRecord> plans = List.of();
            if (category.isSelectionApplied()) {
                state = AnalysisState.SELECTING;
                SelectionOutcome<CandidateRecord> outcome = selectionEngine.select(bound.records(),
                        settings.getResponseTimeThresholdMs(), settings.getCountThreshold());
                toIngest = outcome.selected();
                log.info("{}: {}", definition.eventName(), outcome.stats().getSummary());

                state = AnalysisState.CORRELATED_FETCH;
                plans = planFetcher.fetch(survivorKeys(toIngest));
            }

            state = AnalysisState.INGESTING;
            if (!toIngest.isEmpty()) {
                ingestionAdapter.ingest(definition.eventName(), toIngest);
            }
            int plansIngested = ingestPlans(plans);

            return DefinitionReport.completed(definition, rows.size(), bound.records().size(),
                    bound.skippedRows(), toIngest.size(), plansIngested);
        } catch (RuntimeException e) {
            log.error("Query definition {} failed: {}", definition.eventName(), e.getMessage());
            log.debug("Failure details for {}", definition.eventName(), e);
            return DefinitionReport.failed(definition, e.getMessage());
        }
    }

    private static List<String> survivorKeys(List<CandidateRecord> survivors) {
        return survivors.stream()
                .map(CandidateRecord::correlationKey)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    private int ingestPlans(List<ExecutionPlanRecord> plans) {
        if (plans.isEmpty()) {
            return 0;
        }
        try {
            ingestionAdapter.ingest(ExecutionPlanRecord.EVENT_NAME, plans);
            return plans.size();
        } catch (RuntimeException e) {
            log.error("Could not ingest execution plans: {}", e.getMessage());
            return 0;
        }
    }

    public AnalysisState getState() {
        return state;
    }
}
