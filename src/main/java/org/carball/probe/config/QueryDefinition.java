package org.carball.probe.config;

/**
 * One configured diagnostic query: the event name its rows are reported under, the record category
 * identifier (e.g. {@code slowQueries}) and the SQL template.
 */
public record QueryDefinition(
        String eventName,
        String type,
        String query
) {

    public boolean isComplete() {
        return eventName != null && !eventName.isBlank()
                && type != null && !type.isBlank()
                && query != null && !query.isBlank();
    }
}
