package org.carball.probe.selection;

import org.carball.probe.model.CandidateRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class CostOrdering {

    private CostOrdering() {
        // Utility class - prevent instantiation
    }

    static <T extends CandidateRecord> Comparator<T> ascending() {
        return (a, b) -> Double.compare(a.cost(), b.cost());
    }

    static <T extends CandidateRecord> Comparator<T> descending() {
        return (a, b) -> Double.compare(b.cost(), a.cost());
    }

    static <T extends CandidateRecord> List<T> atOrAbove(List<T> candidates, double threshold) {
        List<T> matching = new ArrayList<>(candidates.size());
        for (T candidate : candidates) {
            if (candidate.cost() >= threshold) {
                matching.add(candidate);
            }
        }
        return matching;
    }

    static int effectiveLimit(int limit, int available) {
        return limit <= 0 ? available : Math.min(limit, available);
    }
}
