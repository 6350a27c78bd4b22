package org.carball.probe.config;

import java.util.List;

/**
 * Query definitions run each cycle, plus the template for the execution-plan fetch.
 */
public record QueryCatalog(
        List<QueryDefinition> definitions,
        String executionPlanQuery
) {

    public QueryCatalog {
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }
}
