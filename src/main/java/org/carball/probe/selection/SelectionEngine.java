package org.carball.probe.selection;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.CandidateRecord;

import java.util.List;

/**
 * Caller-facing top-K selection. Callers see only "sorted by cost descending", never which
 * algorithm ran.
 */
@Slf4j
public class SelectionEngine {

    private final SelectionAlgorithm algorithm;
    private final SelectionStrategy strategy;

    public SelectionEngine(SelectionAlgorithm algorithm) {
        this.algorithm = algorithm;
        this.strategy = algorithm.createStrategy();
    }

    public SelectionEngine() {
        this(SelectionAlgorithm.DEFAULT);
    }

    public <T extends CandidateRecord> List<T> selectTop(List<T> candidates, double thresholdMs, int limit) {
        return strategy.select(candidates, thresholdMs, limit);
    }

    /**
     * Selects and reports how many candidates passed each stage.
     */
    public <T extends CandidateRecord> SelectionOutcome<T> select(List<T> candidates, double thresholdMs, int limit) {
        if (candidates.isEmpty()) {
            log.debug("No candidates to select from");
            return new SelectionOutcome<>(List.of(), new SelectionStats(0, 0, 0, thresholdMs, limit, 0.0, 0.0));
        }

        List<T> selected = strategy.select(candidates, thresholdMs, limit);
        int matched = (int) candidates.stream().filter(c -> c.cost() >= thresholdMs).count();
        double slowest = selected.isEmpty() ? 0.0 : selected.get(0).cost();
        double fastest = selected.isEmpty() ? 0.0 : selected.get(selected.size() - 1).cost();

        SelectionStats stats = new SelectionStats(candidates.size(), matched, selected.size(),
                thresholdMs, limit, slowest, fastest);
        log.debug("Selection [{}]: {}", algorithm.getName(), stats.getSummary());
        return new SelectionOutcome<>(selected, stats);
    }

    public SelectionAlgorithm getAlgorithm() {
        return algorithm;
    }
}
