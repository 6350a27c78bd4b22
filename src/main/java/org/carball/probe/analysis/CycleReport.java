package org.carball.probe.analysis;

import org.carball.probe.model.ValidationResult;

import java.util.List;

/**
 * Outcome of one analysis cycle: the validation result and, unless rejected, one report per definition.
 */
public record CycleReport(
        ValidationResult validation,
        List<DefinitionReport> definitions
) {

    public CycleReport {
        definitions = List.copyOf(definitions);
    }

    public static CycleReport rejected(ValidationResult validation) {
        return new CycleReport(validation, List.of());
    }

    public boolean isRejected() {
        return !validation.passed();
    }

    public long failedCount() {
        return definitions.stream().filter(d -> d.outcome() == DefinitionReport.Outcome.FAILED).count();
    }

    public String getSummary() {
        if (isRejected()) {
            return "Cycle rejected: " + validation.describeFailures();
        }
        long completed = definitions.stream().filter(DefinitionReport::succeeded).count();
        long skipped = definitions.stream().filter(d -> d.outcome() == DefinitionReport.Outcome.SKIPPED).count();
        int ingested = definitions.stream().mapToInt(DefinitionReport::recordsIngested).sum();
        int plans = definitions.stream().mapToInt(DefinitionReport::plansIngested).sum();
        return String.format("%d completed, %d skipped, %d failed | %d records, %d plan nodes ingested",
                completed, skipped, failedCount(), ingested, plans);
    }
}
