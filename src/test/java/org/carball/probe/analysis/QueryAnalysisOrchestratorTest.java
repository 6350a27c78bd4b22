package org.carball.probe.analysis;

import org.carball.probe.binding.CategoryRegistry;
import org.carball.probe.binding.RecordBinder;
import org.carball.probe.binding.SlowQueryBinder;
import org.carball.probe.binding.WaitEventBinder;
import org.carball.probe.config.ProbeSettings;
import org.carball.probe.config.QueryCatalog;
import org.carball.probe.config.QueryDefinition;
import org.carball.probe.ingest.BatchedIngestionAdapter;
import org.carball.probe.ingest.InstanceIdentity;
import org.carball.probe.ingest.MetricSet;
import org.carball.probe.model.BlockingPairRecord;
import org.carball.probe.model.CandidateRecord;
import org.carball.probe.model.ExecutionPlanRecord;
import org.carball.probe.model.RawRow;
import org.carball.probe.model.RecordCategory;
import org.carball.probe.testsupport.FakeSqlConnection;
import org.carball.probe.testsupport.RecordingTelemetrySink;
import org.carball.probe.validation.PreconditionValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.probe.testsupport.FakeSqlConnection.VERSION_FRAGMENT;
import static org.carball.probe.testsupport.FakeSqlConnection.row;

public class QueryAnalysisOrchestratorTest {

    private static final QueryDefinition SLOW = new QueryDefinition(
            "MSSQLTopSlowQueries", "slowQueries", "SELECT slow TOP (${countThreshold})");
    private static final QueryDefinition WAITS = new QueryDefinition(
            "MSSQLWaitTimeAnalysis", "waitAnalysis", "SELECT waits TOP (${countThreshold})");
    private static final QueryDefinition BLOCKING = new QueryDefinition(
            "MSSQLBlockingSessionQueries", "blockingSessions", "SELECT blocking TOP (${countThreshold})");
    private static final String PLAN_TEMPLATE = "SELECT plan FOR '${queryId}' TOP (${planCountLimit})";

    private PreconditionValidator validator;
    private RecordingTelemetrySink sink;
    private FakeSqlConnection connection;
    private ProbeSettings settings;

    @BeforeEach
    void setUp() {
        validator = new PreconditionValidator();
        sink = new RecordingTelemetrySink();
        settings = ProbeSettings.builder().countThreshold(2).responseTimeThresholdMs(500).build();
        connection = FakeSqlConnection.healthyServer()
                .respond("SELECT slow",
                        row("query_id", "0x01", "execution_count", 3, "avg_elapsed_time_ms", 900.0,
                                "query_text", "SELECT * FROM Orders WHERE Id = 1"),
                        row("query_id", "0x02", "execution_count", 8, "avg_elapsed_time_ms", 100.0),
                        row("query_id", "0x03", "execution_count", 2, "avg_elapsed_time_ms", 700.0),
                        row("query_id", "0x04", "execution_count", 5, "avg_elapsed_time_ms", 650.0),
                        row("query_id", "0x05", "execution_count", 0, "avg_elapsed_time_ms", 5000.0))
                .respond("SELECT plan FOR '0x01'",
                        row("sql_text", "SELECT * FROM Orders WHERE Id = 1", "query_id", "0x01", "NodeId", 0),
                        row("sql_text", "SELECT * FROM Orders WHERE Id = 1", "query_id", "0x01", "NodeId", 1))
                .respond("SELECT plan FOR '0x03'",
                        row("sql_text", "UPDATE Stock SET Qty = 0", "query_id", "0x03", "NodeId", 0))
                .respond("SELECT waits",
                        row("query_id", "0x01", "wait_category", "Lock", "avg_wait_time_ms", 40.0))
                .respond("SELECT blocking",
                        row("blocking_spid", 51, "blocked_spid", 62, "wait_time_in_seconds", 1.5));
    }

    @AfterEach
    void tearDown() {
        validator.close();
    }

    @Test
    void shouldRunEveryDefinitionAndIngestSelectedRecords() {
        // Given
        QueryAnalysisOrchestrator orchestrator = orchestrator(SLOW, WAITS, BLOCKING);

        // When
        CycleReport report = orchestrator.runCycle();

        // Then
        assertThat(report.isRejected()).isFalse();
        assertThat(report.definitions()).extracting(DefinitionReport::outcome)
                .containsOnly(DefinitionReport.Outcome.COMPLETED);

        List<MetricSet> slow = sink.getPublished("MSSQLTopSlowQueries");
        assertThat(slow).extracting(m -> m.get("query_id").value()).containsExactly("0x01", "0x03");
        assertThat(slow.get(0).get("query_text").value()).isEqualTo("SELECT * FROM Orders WHERE Id = ?");
        assertThat(slow.get(0).get("displayName").value()).isEqualTo("SQLPROD01");

        assertThat(sink.getPublished("MSSQLWaitTimeAnalysis")).hasSize(1);
        assertThat(sink.getPublished("MSSQLBlockingSessionQueries")).hasSize(1);

        DefinitionReport slowReport = report.definitions().get(0);
        assertThat(slowReport.rowsFetched()).isEqualTo(5);
        assertThat(slowReport.recordsBound()).isEqualTo(4);
        assertThat(slowReport.rowsSkipped()).isEqualTo(1);
        assertThat(slowReport.recordsIngested()).isEqualTo(2);
        assertThat(orchestrator.getState()).isEqualTo(AnalysisState.IDLE);
    }

    @Test
    void shouldFetchExecutionPlansOnlyForSelectedQueries() {
        // When
        CycleReport report = orchestrator(SLOW).runCycle();

        // Then
        assertThat(connection.countExecuted("SELECT plan FOR '0x01' TOP (2)")).isEqualTo(1);
        assertThat(connection.countExecuted("SELECT plan FOR '0x03' TOP (2)")).isEqualTo(1);
        assertThat(connection.countExecuted("SELECT plan FOR '0x04'")).isZero();
        assertThat(connection.countExecuted("SELECT plan FOR '0x02'")).isZero();

        assertThat(sink.getPublished(ExecutionPlanRecord.EVENT_NAME))
                .extracting(m -> m.get("query_id").value())
                .containsExactly("0x01", "0x01", "0x03");
        assertThat(report.definitions().get(0).plansIngested()).isEqualTo(3);
    }

    @Test
    void shouldAbortCycleWhenValidationRejects() {
        // Given
        connection.override(VERSION_FRAGMENT, () -> List.of(row("version", "Microsoft SQL Server 2012 - 11.0.7001.0")));
        QueryAnalysisOrchestrator orchestrator = orchestrator(SLOW, WAITS, BLOCKING);

        // When
        CycleReport report = orchestrator.runCycle();

        // Then
        assertThat(report.isRejected()).isTrue();
        assertThat(report.definitions()).isEmpty();
        assertThat(report.getSummary()).contains("unsupported version").doesNotContain("permission");
        assertThat(connection.countExecuted("SELECT slow")).isZero();
        assertThat(connection.countExecuted("SELECT waits")).isZero();
        assertThat(sink.getPublished()).isEmpty();
        assertThat(orchestrator.getState()).isEqualTo(AnalysisState.IDLE);
    }

    @Test
    void shouldContainFailureToOneDefinitionAfterRetries() {
        // Given
        connection.override("SELECT waits", () -> {
            throw new SQLException("Transaction was deadlocked");
        });

        // When
        CycleReport report = orchestrator(WAITS, BLOCKING).runCycle();

        // Then
        assertThat(connection.countExecuted("SELECT waits")).isEqualTo(3);
        assertThat(report.definitions()).extracting(DefinitionReport::outcome)
                .containsExactly(DefinitionReport.Outcome.FAILED, DefinitionReport.Outcome.COMPLETED);
        assertThat(report.definitions().get(0).failure()).contains("deadlocked");
        assertThat(report.failedCount()).isEqualTo(1);
        assertThat(sink.getPublished("MSSQLBlockingSessionQueries")).hasSize(1);
    }

    @Test
    void shouldRecoverFromTransientQueryFailure() {
        connection.override("SELECT blocking", new FlakyResponse(2));

        CycleReport report = orchestrator(BLOCKING).runCycle();

        assertThat(connection.countExecuted("SELECT blocking")).isEqualTo(3);
        assertThat(report.definitions().get(0).succeeded()).isTrue();
        assertThat(sink.getPublished("MSSQLBlockingSessionQueries")).hasSize(1);
    }

    @Test
    void shouldSkipDefinitionWithUnknownType() {
        // Given
        QueryDefinition deadlocks = new QueryDefinition("MSSQLDeadlocks", "deadlocks", "SELECT deadlocks");

        // When
        CycleReport report = orchestrator(deadlocks, BLOCKING).runCycle();

        // Then
        assertThat(report.definitions()).extracting(DefinitionReport::outcome)
                .containsExactly(DefinitionReport.Outcome.SKIPPED, DefinitionReport.Outcome.COMPLETED);
        assertThat(report.definitions().get(0).failure()).contains("Unknown query type: deadlocks");
        assertThat(connection.countExecuted("SELECT deadlocks")).isZero();
    }

    @Test
    void shouldKeepSlowQueriesWhenPlanFetchFails() {
        // Given
        connection.override("SELECT plan", () -> {
            throw new SQLException("XML parsing error");
        });

        // When
        CycleReport report = orchestrator(SLOW).runCycle();

        // Then
        DefinitionReport slowReport = report.definitions().get(0);
        assertThat(slowReport.succeeded()).isTrue();
        assertThat(slowReport.plansIngested()).isZero();
        assertThat(sink.getPublished("MSSQLTopSlowQueries")).hasSize(2);
        assertThat(sink.getPublished(ExecutionPlanRecord.EVENT_NAME)).isEmpty();
    }

    @Test
    void shouldRecordIngestionFailureAndContinue() {
        // Given
        sink.failOnPublish(0);

        // When
        CycleReport report = orchestrator(WAITS, BLOCKING).runCycle();

        // Then
        assertThat(report.definitions()).extracting(DefinitionReport::outcome)
                .containsExactly(DefinitionReport.Outcome.FAILED, DefinitionReport.Outcome.COMPLETED);
        assertThat(report.definitions().get(0).failure()).contains("Error ingesting batch from 0 to 1");
        assertThat(sink.getPublished("MSSQLBlockingSessionQueries")).hasSize(1);
    }

    @Test
    void shouldCompleteWithNothingToIngest() {
        connection.override("SELECT slow", List::of);

        CycleReport report = orchestrator(SLOW).runCycle();

        assertThat(report.definitions().get(0).succeeded()).isTrue();
        assertThat(report.definitions().get(0).recordsIngested()).isZero();
        assertThat(sink.getPublished()).isEmpty();
        assertThat(connection.countExecuted("SELECT plan")).isZero();
    }

    @Test
    void shouldTreatZeroCountThresholdAsUnlimited() {
        // Given
        settings = settings.toBuilder().countThreshold(0).build();

        // When
        CycleReport report = orchestrator(SLOW).runCycle();

        // Then
        assertThat(connection.countExecuted("SELECT slow TOP (30)")).isEqualTo(1);
        assertThat(sink.getPublished("MSSQLTopSlowQueries"))
                .extracting(m -> m.get("query_id").value())
                .containsExactly("0x01", "0x03", "0x04");
        assertThat(report.definitions().get(0).recordsIngested()).isEqualTo(3);
    }

    @Test
    void shouldContainUnexpectedBinderFailureToOneDefinition() {
        // Given
        RecordBinder<BlockingPairRecord> broken = row -> {
            throw new IllegalStateException("Attribute view unavailable");
        };
        CategoryRegistry registry = new CategoryRegistry(Map.<RecordCategory, RecordBinder<? extends CandidateRecord>>of(
                RecordCategory.SLOW_QUERY, new SlowQueryBinder(),
                RecordCategory.WAIT_EVENT, new WaitEventBinder(),
                RecordCategory.BLOCKING_PAIR, broken));
        QueryAnalysisOrchestrator orchestrator = new QueryAnalysisOrchestrator(connection, settings,
                new QueryCatalog(List.of(BLOCKING, WAITS), PLAN_TEMPLATE), validator, registry,
                new BatchedIngestionAdapter(sink, new InstanceIdentity("SQLPROD01", "db-test-01"),
                        settings.getBatchSize()));

        // When
        CycleReport report = orchestrator.runCycle();

        // Then
        assertThat(report.definitions()).extracting(DefinitionReport::outcome)
                .containsExactly(DefinitionReport.Outcome.FAILED, DefinitionReport.Outcome.COMPLETED);
        assertThat(report.definitions().get(0).failure()).isEqualTo("Attribute view unavailable");
        assertThat(sink.getPublished("MSSQLWaitTimeAnalysis")).hasSize(1);
        assertThat(orchestrator.getState()).isEqualTo(AnalysisState.IDLE);
    }

    private QueryAnalysisOrchestrator orchestrator(QueryDefinition... definitions) {
        QueryCatalog catalog = new QueryCatalog(List.of(definitions), PLAN_TEMPLATE);
        return QueryAnalysisOrchestrator.create(connection, settings, catalog, validator, sink);
    }

    private static final class FlakyResponse implements FakeSqlConnection.Response {
        private int failuresLeft;

        FlakyResponse(int failures) {
            this.failuresLeft = failures;
        }

        @Override
        public List<RawRow> answer() throws SQLException {
            if (failuresLeft-- > 0) {
                throw new SQLException("Connection reset");
            }
            return List.of(row("blocking_spid", 51, "blocked_spid", 62));
        }
    }
}
