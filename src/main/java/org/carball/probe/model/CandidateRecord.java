package org.carball.probe.model;

/**
 * Typed result of one diagnostic row, ranked by {@link #cost()}.
 */
public interface CandidateRecord extends ReportableRecord {

    RecordCategory category();

    /**
     * Identifier linking this record to a later detailed fetch, or null when the category has none.
     */
    String correlationKey();

    /**
     * Ranking cost in milliseconds.
     */
    double cost();
}
