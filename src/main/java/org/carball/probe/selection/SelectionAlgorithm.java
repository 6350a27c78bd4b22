package org.carball.probe.selection;

import lombok.Getter;

import java.util.function.Supplier;

/**
 * Available top-K selection strategies. {@link #BOUNDED_HEAP} is the default.
 */
@Getter
public enum SelectionAlgorithm {

    FULL_SORT("full-sort", "Filter, sort all survivors, truncate - O(n log n)", FullSortSelection::new),
    BOUNDED_HEAP("bounded-heap", "Size-K min-heap over the stream - O(n log K)", BoundedHeapSelection::new),
    QUICKSELECT("quickselect", "Partition around the K-th largest, sort K - O(n) average", QuickSelectSelection::new);

    public static final SelectionAlgorithm DEFAULT = BOUNDED_HEAP;

    private final String name;
    private final String description;
    private final Supplier<SelectionStrategy> factory;

    SelectionAlgorithm(String name, String description, Supplier<SelectionStrategy> factory) {
        this.name = name;
        this.description = description;
        this.factory = factory;
    }

    public SelectionStrategy createStrategy() {
        return factory.get();
    }

    /**
     * Finds an algorithm by name (case-insensitive), accepting both {@code bounded-heap} and {@code BOUNDED_HEAP}.
     */
    public static SelectionAlgorithm fromName(String name) {
        for (SelectionAlgorithm algorithm : values()) {
            if (algorithm.name.equalsIgnoreCase(name) || algorithm.name().equalsIgnoreCase(name)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown selection algorithm: " + name +
                ". Available algorithms: full-sort, bounded-heap, quickselect");
    }
}
