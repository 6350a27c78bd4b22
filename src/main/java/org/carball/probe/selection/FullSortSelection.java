package org.carball.probe.selection;

import org.carball.probe.model.CandidateRecord;

import java.util.List;

/**
 * Filter, sort everything, truncate. O(n log n) time, O(n) space.
 * The reference the other strategies are checked against.
 */
public class FullSortSelection implements SelectionStrategy {

    @Override
    public <T extends CandidateRecord> List<T> select(List<T> candidates, double threshold, int limit) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<T> matching = CostOrdering.atOrAbove(candidates, threshold);
        if (matching.isEmpty()) {
            return List.of();
        }
        matching.sort(CostOrdering.descending());
        return List.copyOf(matching.subList(0, CostOrdering.effectiveLimit(limit, matching.size())));
    }
}
