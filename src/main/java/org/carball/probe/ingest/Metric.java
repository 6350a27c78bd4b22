package org.carball.probe.ingest;

/**
 * A single named value of a metric set. Gauges hold a {@link Double}, attributes a {@link String}.
 */
public record Metric(String name, Object value, MetricType type) {}
