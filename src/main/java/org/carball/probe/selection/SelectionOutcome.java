package org.carball.probe.selection;

import org.carball.probe.model.CandidateRecord;

import java.util.List;

public record SelectionOutcome<T extends CandidateRecord>(
        List<T> selected,
        SelectionStats stats
) {}
