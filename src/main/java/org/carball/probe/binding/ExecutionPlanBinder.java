package org.carball.probe.binding;

import org.carball.probe.model.ExecutionPlanRecord;
import org.carball.probe.model.RawRow;

public class ExecutionPlanBinder implements RecordBinder<ExecutionPlanRecord> {

    @Override
    public ExecutionPlanRecord bind(RawRow row) {
        return new ExecutionPlanRecord(
                TextAnonymizer.anonymize(row.requireString("sql_text")),
                row.getHex("query_id"),
                row.getHex("query_plan_id"),
                row.getInt("NodeId"),
                row.getString("PhysicalOp"),
                row.getString("LogicalOp"),
                row.getDouble("EstimateRows"),
                row.getDouble("EstimateIO"),
                row.getDouble("EstimateCPU"),
                row.getDouble("AvgRowSize"),
                row.getDouble("TotalSubtreeCost"),
                row.getDouble("EstimatedOperatorCost"),
                row.getString("EstimatedExecutionMode"),
                row.getInt("GrantedMemoryKb"),
                row.getBoolean("SpillOccurred"),
                row.getBoolean("NoJoinPredicate"),
                row.getLong("total_worker_time"),
                row.getLong("total_elapsed_time"),
                row.getLong("total_logical_reads"),
                row.getLong("total_logical_writes"),
                row.getLong("execution_count"),
                row.getHex("plan_handle"),
                row.getDouble("avg_elapsed_time_ms")
        );
    }
}
