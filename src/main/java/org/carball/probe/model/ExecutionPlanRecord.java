package org.carball.probe.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One operator node of a cached execution plan, fetched for a slow query's hash.
 */
public record ExecutionPlanRecord(
        String sqlText,
        String queryId,
        String queryPlanId,
        Integer nodeId,
        String physicalOp,
        String logicalOp,
        Double estimateRows,
        Double estimateIo,
        Double estimateCpu,
        Double avgRowSize,
        Double totalSubtreeCost,
        Double estimatedOperatorCost,
        String estimatedExecutionMode,
        Integer grantedMemoryKb,
        Boolean spillOccurred,
        Boolean noJoinPredicate,
        Long totalWorkerTime,
        Long totalElapsedTime,
        Long totalLogicalReads,
        Long totalLogicalWrites,
        Long executionCount,
        String planHandle,
        Double avgElapsedTimeMs
) implements ReportableRecord {

    public static final String EVENT_NAME = "MSSQLQueryExecutionPlans";

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("sql_text", sqlText);
        attributes.put("query_id", queryId);
        attributes.put("query_plan_id", queryPlanId);
        attributes.put("NodeId", nodeId);
        attributes.put("PhysicalOp", physicalOp);
        attributes.put("LogicalOp", logicalOp);
        attributes.put("EstimateRows", estimateRows);
        attributes.put("EstimateIO", estimateIo);
        attributes.put("EstimateCPU", estimateCpu);
        attributes.put("AvgRowSize", avgRowSize);
        attributes.put("TotalSubtreeCost", totalSubtreeCost);
        attributes.put("EstimatedOperatorCost", estimatedOperatorCost);
        attributes.put("EstimatedExecutionMode", estimatedExecutionMode);
        attributes.put("GrantedMemoryKb", grantedMemoryKb);
        attributes.put("SpillOccurred", spillOccurred);
        attributes.put("NoJoinPredicate", noJoinPredicate);
        attributes.put("total_worker_time", totalWorkerTime);
        attributes.put("total_elapsed_time", totalElapsedTime);
        attributes.put("total_logical_reads", totalLogicalReads);
        attributes.put("total_logical_writes", totalLogicalWrites);
        attributes.put("execution_count", executionCount);
        attributes.put("plan_handle", planHandle);
        attributes.put("avg_elapsed_time_ms", avgElapsedTimeMs);
        return attributes;
    }
}
