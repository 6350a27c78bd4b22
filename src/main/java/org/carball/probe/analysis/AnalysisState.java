package org.carball.probe.analysis;

/**
 * Phases of one analysis cycle. A cycle always ends back in {@link #IDLE}.
 */
public enum AnalysisState {
    IDLE,
    VALIDATING,
    EXECUTING,
    BINDING,
    SELECTING,
    CORRELATED_FETCH,
    INGESTING
}
