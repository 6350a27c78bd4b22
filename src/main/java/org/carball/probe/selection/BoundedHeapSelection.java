package org.carball.probe.selection;

import org.carball.probe.model.CandidateRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps a min-heap of at most K records while streaming the input. O(n log K) time, O(K) space.
 *
 * <p>Once the heap is full a record displaces the current minimum only when its cost is strictly
 * greater, so among equal costs the earliest seen stay in the heap.
 */
public class BoundedHeapSelection implements SelectionStrategy {

    @Override
    public <T extends CandidateRecord> List<T> select(List<T> candidates, double threshold, int limit) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        int capacity = limit <= 0 ? candidates.size() : limit;
        PriorityQueue<T> heap = new PriorityQueue<>(Math.min(capacity, candidates.size()), CostOrdering.ascending());

        for (T candidate : candidates) {
            double cost = candidate.cost();
            if (cost < threshold) {
                continue;
            }
            if (heap.size() < capacity) {
                heap.offer(candidate);
            } else if (cost > heap.peek().cost()) {
                heap.poll();
                heap.offer(candidate);
            }
        }

        // Draining a min-heap yields ascending cost.
        List<T> result = new ArrayList<>(heap.size());
        while (!heap.isEmpty()) {
            result.add(heap.poll());
        }
        Collections.reverse(result);
        return List.copyOf(result);
    }
}
