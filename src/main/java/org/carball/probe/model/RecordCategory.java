package org.carball.probe.model;

import lombok.Getter;
import org.carball.probe.exception.UnknownCategoryException;

/**
 * Closed set of record shapes a diagnostic query can produce.
 */
@Getter
public enum RecordCategory {

    SLOW_QUERY("slowQueries", true),
    WAIT_EVENT("waitAnalysis", false),
    BLOCKING_PAIR("blockingSessions", false);

    private final String identifier;
    private final boolean selectionApplied;

    RecordCategory(String identifier, boolean selectionApplied) {
        this.identifier = identifier;
        this.selectionApplied = selectionApplied;
    }

    /**
     * Resolves the identifier used in query definitions (case-sensitive, as configured).
     */
    public static RecordCategory fromIdentifier(String identifier) {
        for (RecordCategory category : values()) {
            if (category.identifier.equals(identifier)) {
                return category;
            }
        }
        throw new UnknownCategoryException(identifier);
    }
}
