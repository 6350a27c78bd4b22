package org.carball.probe.analysis;

import org.carball.probe.config.QueryDefinition;

/**
 * What happened to one query definition during a cycle.
 */
public record DefinitionReport(
        String eventName,
        String type,
        Outcome outcome,
        int rowsFetched,
        int recordsBound,
        int rowsSkipped,
        int recordsIngested,
        int plansIngested,
        String failure
) {

    public enum Outcome {
        COMPLETED,
        SKIPPED,
        FAILED
    }

    public static DefinitionReport completed(QueryDefinition definition, int rowsFetched, int recordsBound,
                                              int rowsSkipped, int recordsIngested, int plansIngested) {
        return new DefinitionReport(definition.eventName(), definition.type(), Outcome.COMPLETED,
                rowsFetched, recordsBound, rowsSkipped, recordsIngested, plansIngested, null);
    }

    public static DefinitionReport skipped(QueryDefinition definition, String reason) {
        return new DefinitionReport(definition.eventName(), definition.type(), Outcome.SKIPPED,
                0, 0, 0, 0, 0, reason);
    }

    public static DefinitionReport failed(QueryDefinition definition, String reason) {
        return new DefinitionReport(definition.eventName(), definition.type(), Outcome.FAILED,
                0, 0, 0, 0, 0, reason);
    }

    public boolean succeeded() {
        return outcome == Outcome.COMPLETED;
    }
}
