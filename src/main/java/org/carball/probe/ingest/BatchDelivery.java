package org.carball.probe.ingest;

@FunctionalInterface
public interface BatchDelivery<T> {

    void deliver(Batch<T> batch) throws Exception;
}
