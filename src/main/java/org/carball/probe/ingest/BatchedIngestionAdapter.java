package org.carball.probe.ingest;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.exception.IngestionException;
import org.carball.probe.model.ReportableRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Delivers records to the telemetry sink in bounded, order-preserving batches.
 *
 * <p>Delivery is fail-fast: the first failing batch raises {@link IngestionException} and the rest
 * are not attempted. Batches already published stay published.
 */
@Slf4j
public class BatchedIngestionAdapter {

    private final TelemetrySink sink;
    private final InstanceIdentity identity;
    private final int batchSize;

    public BatchedIngestionAdapter(TelemetrySink sink, InstanceIdentity identity, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.sink = sink;
        this.identity = identity;
        this.batchSize = batchSize;
    }

    /**
     * Splits {@code items} into ceil(n / batchSize) contiguous batches; only the last may be short.
     */
    public static <T> List<Batch<T>> partition(List<T> items, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        List<Batch<T>> batches = new ArrayList<>((items.size() + batchSize - 1) / batchSize);
        for (int start = 0; start < items.size(); start += batchSize) {
            int end = Math.min(start + batchSize, items.size());
            batches.add(new Batch<>(start, end, items.subList(start, end)));
        }
        return batches;
    }

    /**
     * Reports every record under {@code eventName}, one metric set per record, publishing once per batch.
     *
     * @return the number of batches delivered
     */
    public int ingest(String eventName, List<? extends ReportableRecord> records) {
        int delivered = ingest(records, batch -> {
            for (ReportableRecord record : batch.items()) {
                sink.emit(MetricSet.of(eventName, identity, record.attributes()));
            }
            sink.publish();
        });
        log.info("Ingested {} {} records in {} batches", records.size(), eventName, delivered);
        return delivered;
    }

    public <T> int ingest(List<T> items, BatchDelivery<T> delivery) {
        int delivered = 0;
        for (Batch<T> batch : partition(items, batchSize)) {
            try {
                delivery.deliver(batch);
            } catch (Exception e) {
                log.error("Batch [{}, {}) failed, abandoning the remaining batches: {}",
                        batch.startIndex(), batch.endIndex(), e.getMessage());
                throw new IngestionException(batch.startIndex(), batch.endIndex(), e);
            }
            delivered++;
        }
        return delivered;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
