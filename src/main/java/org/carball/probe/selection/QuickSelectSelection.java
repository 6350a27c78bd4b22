package org.carball.probe.selection;

import org.carball.probe.model.CandidateRecord;

import java.util.Collections;
import java.util.List;

/**
 * Filters, partitions around the K-th largest cost, then sorts only the first K.
 * O(n) average and O(n^2) worst-case time, O(n) space for the filtered copy.
 */
public class QuickSelectSelection implements SelectionStrategy {

    @Override
    public <T extends CandidateRecord> List<T> select(List<T> candidates, double threshold, int limit) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<T> matching = CostOrdering.atOrAbove(candidates, threshold);
        if (matching.isEmpty()) {
            return List.of();
        }

        int k = CostOrdering.effectiveLimit(limit, matching.size());
        if (k < matching.size()) {
            selectLargest(matching, k - 1);
            matching = matching.subList(0, k);
        }
        matching.sort(CostOrdering.descending());
        return List.copyOf(matching);
    }

    /**
     * Rearranges {@code records} so that index {@code target} holds the (target+1)-th largest cost
     * and every record before it costs at least as much.
     */
    private static <T extends CandidateRecord> void selectLargest(List<T> records, int target) {
        int left = 0;
        int right = records.size() - 1;
        while (left < right) {
            int pivotIndex = partition(records, left, right);
            if (pivotIndex == target) {
                return;
            } else if (target < pivotIndex) {
                right = pivotIndex - 1;
            } else {
                left = pivotIndex + 1;
            }
        }
    }

    // Lomuto partition, descending: costs greater than the pivot end up on its left.
    private static <T extends CandidateRecord> int partition(List<T> records, int left, int right) {
        Collections.swap(records, left + (right - left) / 2, right);
        double pivot = records.get(right).cost();
        int store = left;
        for (int i = left; i < right; i++) {
            if (records.get(i).cost() > pivot) {
                Collections.swap(records, store, i);
                store++;
            }
        }
        Collections.swap(records, store, right);
        return store;
    }
}
