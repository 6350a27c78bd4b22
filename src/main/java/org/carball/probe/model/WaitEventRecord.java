package org.carball.probe.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wait statistics for one query in one wait category, taken from Query Store.
 */
public record WaitEventRecord(
        String queryId,
        String databaseName,
        String queryText,
        String waitCategory,
        Double totalWaitTimeMs,
        Double avgWaitTimeMs,
        Long waitEventCount,
        String lastExecutionTime,
        String collectionTimestamp
) implements CandidateRecord {

    @Override
    public RecordCategory category() {
        return RecordCategory.WAIT_EVENT;
    }

    @Override
    public String correlationKey() {
        return queryId;
    }

    @Override
    public double cost() {
        return avgWaitTimeMs == null ? 0.0 : avgWaitTimeMs;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("query_id", queryId);
        attributes.put("database_name", databaseName);
        attributes.put("query_text", queryText);
        attributes.put("wait_category", waitCategory);
        attributes.put("total_wait_time_ms", totalWaitTimeMs);
        attributes.put("avg_wait_time_ms", avgWaitTimeMs);
        attributes.put("wait_event_count", waitEventCount);
        attributes.put("last_execution_time", lastExecutionTime);
        attributes.put("collection_timestamp", collectionTimestamp);
        return attributes;
    }
}
