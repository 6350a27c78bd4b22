package org.carball.probe.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One reported event: an event name, the instance identity and the record's classified values.
 */
public final class MetricSet {

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final String eventName;
    private final List<Metric> metrics = new ArrayList<>();

    public MetricSet(String eventName, InstanceIdentity identity) {
        this.eventName = eventName;
        identity.attributes().forEach((name, value) -> metrics.add(new Metric(name, value, MetricType.ATTRIBUTE)));
    }

    public static MetricSet of(String eventName, InstanceIdentity identity, Map<String, Object> values) {
        MetricSet metricSet = new MetricSet(eventName, identity);
        values.forEach(metricSet::set);
        return metricSet;
    }

    /**
     * Adds a value as a gauge when its string form is numeric, otherwise as an attribute. Nulls are skipped.
     */
    public MetricSet set(String name, Object value) {
        if (value == null) {
            return this;
        }
        String text = String.valueOf(value);
        if (isNumeric(text)) {
            metrics.add(new Metric(name, Double.parseDouble(text), MetricType.GAUGE));
        } else {
            metrics.add(new Metric(name, text, MetricType.ATTRIBUTE));
        }
        return this;
    }

    static boolean isNumeric(String text) {
        return NUMERIC.matcher(text.trim()).matches();
    }

    public String getEventName() {
        return eventName;
    }

    public List<Metric> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    public Metric get(String name) {
        for (Metric metric : metrics) {
            if (metric.name().equals(name)) {
                return metric;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "MetricSet[" + eventName + ", " + metrics.size() + " metrics]";
    }
}
