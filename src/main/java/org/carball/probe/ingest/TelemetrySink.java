package org.carball.probe.ingest;

import java.io.IOException;

/**
 * Destination for metric sets. Emitted sets are buffered until {@link #publish()}.
 */
public interface TelemetrySink {

    void emit(MetricSet metricSet);

    void publish() throws IOException;
}
