package org.carball.probe.model;

import java.util.Map;

/**
 * A bound row that can be reported as one metric set.
 */
public interface ReportableRecord {

    /**
     * Ordered attribute view of this record, keyed by metric name. Values may be null.
     */
    Map<String, Object> attributes();
}
