package org.carball.probe.model;

/**
 * One row of {@code sys.databases} as seen by the precondition validator.
 */
public record DatabaseDetails(
        int databaseId,
        String name,
        int compatibilityLevel,
        boolean queryStoreOn
) {}
