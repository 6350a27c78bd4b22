package org.carball.probe.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes each published metric set as one JSON object per line.
 */
@Slf4j
public class JsonLinesTelemetrySink implements TelemetrySink {

    public static final String EVENT_TYPE_FIELD = "event_type";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Writer writer;
    private final List<MetricSet> pending = new ArrayList<>();

    public JsonLinesTelemetrySink(Writer writer) {
        this.writer = writer;
    }

    public static JsonLinesTelemetrySink toStdout() {
        return new JsonLinesTelemetrySink(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    }

    @Override
    public synchronized void emit(MetricSet metricSet) {
        pending.add(metricSet);
    }

    @Override
    public synchronized void publish() throws IOException {
        // A failed publish drops its metric sets so they never ride along with a later batch.
        List<MetricSet> batch = new ArrayList<>(pending);
        pending.clear();
        for (MetricSet metricSet : batch) {
            writer.write(objectMapper.writeValueAsString(toJson(metricSet)));
            writer.write(System.lineSeparator());
        }
        writer.flush();
        log.debug("Published {} metric sets", batch.size());
    }

    ObjectNode toJson(MetricSet metricSet) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(EVENT_TYPE_FIELD, metricSet.getEventName());
        for (Metric metric : metricSet.getMetrics()) {
            if (metric.type() == MetricType.GAUGE) {
                node.put(metric.name(), (Double) metric.value());
            } else {
                node.put(metric.name(), (String) metric.value());
            }
        }
        return node;
    }
}
