package org.carball.probe.ingest;

import java.util.List;

/**
 * Contiguous slice {@code [startIndex, endIndex)} of a result set.
 */
public record Batch<T>(int startIndex, int endIndex, List<T> items) {

    public Batch {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
