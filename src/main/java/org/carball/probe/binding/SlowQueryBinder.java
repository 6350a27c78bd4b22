package org.carball.probe.binding;

import org.carball.probe.exception.RowBindException;
import org.carball.probe.model.RawRow;
import org.carball.probe.model.SlowQueryRecord;

/**
 * Binds rows of the top slow queries definition.
 *
 * <p>Averages come from the {@code avg_*} columns when present; otherwise they are derived from
 * the matching {@code total_*} column divided by {@code execution_count}.
 */
public class SlowQueryBinder implements RecordBinder<SlowQueryRecord> {

    @Override
    public SlowQueryRecord bind(RawRow row) {
        long executionCount = row.requireLong("execution_count");
        if (executionCount <= 0) {
            throw new RowBindException("Slow query row has no executions: execution_count=" + executionCount);
        }

        Double avgElapsed = average(row, "avg_elapsed_time_ms", "total_elapsed_time_ms", executionCount);
        if (avgElapsed == null) {
            throw new RowBindException("Slow query row has neither avg_elapsed_time_ms nor total_elapsed_time_ms");
        }

        return new SlowQueryRecord(
                row.getHex("query_id"),
                TextAnonymizer.anonymize(row.getString("query_text")),
                row.getString("database_name"),
                row.getString("schema_name"),
                row.getString("last_execution_timestamp"),
                executionCount,
                average(row, "avg_cpu_time_ms", "total_cpu_time_ms", executionCount),
                avgElapsed,
                row.getDouble("avg_disk_reads"),
                row.getDouble("avg_disk_writes"),
                row.getString("statement_type"),
                row.getString("collection_timestamp")
        );
    }

    private static Double average(RawRow row, String averageColumn, String totalColumn, long executionCount) {
        Double average = row.getDouble(averageColumn);
        if (average != null) {
            return average;
        }
        Double total = row.getDouble(totalColumn);
        return total == null ? null : total / executionCount;
    }
}
