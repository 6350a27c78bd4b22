package org.carball.probe.analysis;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.binding.ExecutionPlanBinder;
import org.carball.probe.binding.ResultBinder;
import org.carball.probe.config.ProbeSettings;
import org.carball.probe.config.QueryTemplateFormatter;
import org.carball.probe.connection.SqlConnection;
import org.carball.probe.exception.QueryAnalysisException;
import org.carball.probe.model.ExecutionPlanRecord;
import org.carball.probe.model.RawRow;
import org.carball.probe.retry.RetryExecutor;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches execution plan nodes for selected slow queries, one query hash at a time.
 * A failed fetch is logged and contributes no plans.
 */
@Slf4j
public class ExecutionPlanFetcher {

    private final SqlConnection connection;
    private final ProbeSettings settings;
    private final String template;
    private final ResultBinder resultBinder;
    private final RetryExecutor retryExecutor;
    private final ExecutionPlanBinder planBinder = new ExecutionPlanBinder();

    public ExecutionPlanFetcher(SqlConnection connection, ProbeSettings settings, String template,
                                ResultBinder resultBinder, RetryExecutor retryExecutor) {
        this.connection = connection;
        this.settings = settings;
        this.template = template;
        this.resultBinder = resultBinder;
        this.retryExecutor = retryExecutor;
    }

    public List<ExecutionPlanRecord> fetch(List<String> queryIds) {
        if (template == null || template.isBlank() || queryIds.isEmpty()) {
            return List.of();
        }

        List<ExecutionPlanRecord> plans = new ArrayList<>();
        for (String queryId : queryIds) {
            try {
                String sql = QueryTemplateFormatter.format(template,
                        QueryTemplateFormatter.planValuesFor(settings, queryId));
                List<RawRow> rows = retryExecutor.execute("Execution plan fetch for " + queryId,
                        () -> connection.query(sql));
                plans.addAll(resultBinder.bindAll(planBinder, rows));
            } catch (QueryAnalysisException | IllegalArgumentException e) {
                log.error("Could not fetch execution plans for query {}: {}", queryId, e.getMessage());
            }
        }
        log.debug("Fetched {} plan nodes for {} queries", plans.size(), queryIds.size());
        return plans;
    }
}
