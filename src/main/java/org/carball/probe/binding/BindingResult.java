package org.carball.probe.binding;

import org.carball.probe.model.CandidateRecord;
import org.carball.probe.model.RecordCategory;

import java.util.List;

/**
 * Records bound from one result set, the correlation keys collected along the way
 * and the number of rows that could not be bound.
 */
public record BindingResult(
        RecordCategory category,
        List<CandidateRecord> records,
        List<String> correlationKeys,
        int skippedRows
) {

    public BindingResult {
        records = List.copyOf(records);
        correlationKeys = List.copyOf(correlationKeys);
    }
}
