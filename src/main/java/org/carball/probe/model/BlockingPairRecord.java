package org.carball.probe.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A blocking session and the session it blocks.
 */
public record BlockingPairRecord(
        Long blockingSpid,
        String blockingStatus,
        Long blockedSpid,
        String blockedStatus,
        String waitType,
        Double waitTimeInSeconds,
        String commandType,
        String databaseName,
        String blockingQueryText,
        String blockedQueryText,
        String blockedQueryStartTime
) implements CandidateRecord {

    @Override
    public RecordCategory category() {
        return RecordCategory.BLOCKING_PAIR;
    }

    @Override
    public String correlationKey() {
        return null;
    }

    @Override
    public double cost() {
        return waitTimeInSeconds == null ? 0.0 : waitTimeInSeconds * 1000.0;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("blocking_spid", blockingSpid);
        attributes.put("blocking_status", blockingStatus);
        attributes.put("blocked_spid", blockedSpid);
        attributes.put("blocked_status", blockedStatus);
        attributes.put("wait_type", waitType);
        attributes.put("wait_time_in_seconds", waitTimeInSeconds);
        attributes.put("command_type", commandType);
        attributes.put("database_name", databaseName);
        attributes.put("blocking_query_text", blockingQueryText);
        attributes.put("blocked_query_text", blockedQueryText);
        attributes.put("blocked_query_start_time", blockedQueryStartTime);
        return attributes;
    }
}
