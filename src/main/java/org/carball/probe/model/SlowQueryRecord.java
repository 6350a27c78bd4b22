package org.carball.probe.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Grouped statistics for one query hash from {@code sys.dm_exec_query_stats}.
 * The query hash doubles as the correlation key for the execution-plan fetch.
 */
public record SlowQueryRecord(
        String queryId,
        String queryText,
        String databaseName,
        String schemaName,
        String lastExecutionTimestamp,
        long executionCount,
        Double avgCpuTimeMs,
        double avgElapsedTimeMs,
        Double avgDiskReads,
        Double avgDiskWrites,
        String statementType,
        String collectionTimestamp
) implements CandidateRecord {

    @Override
    public RecordCategory category() {
        return RecordCategory.SLOW_QUERY;
    }

    @Override
    public String correlationKey() {
        return queryId;
    }

    @Override
    public double cost() {
        return avgElapsedTimeMs;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("query_id", queryId);
        attributes.put("query_text", queryText);
        attributes.put("database_name", databaseName);
        attributes.put("schema_name", schemaName);
        attributes.put("last_execution_timestamp", lastExecutionTimestamp);
        attributes.put("execution_count", executionCount);
        attributes.put("avg_cpu_time_ms", avgCpuTimeMs);
        attributes.put("avg_elapsed_time_ms", avgElapsedTimeMs);
        attributes.put("avg_disk_reads", avgDiskReads);
        attributes.put("avg_disk_writes", avgDiskWrites);
        attributes.put("statement_type", statementType);
        attributes.put("collection_timestamp", collectionTimestamp);
        return attributes;
    }
}
