package org.carball.probe.ingest;

public enum MetricType {
    GAUGE,
    ATTRIBUTE
}
