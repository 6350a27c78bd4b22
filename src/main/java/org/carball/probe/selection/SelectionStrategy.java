package org.carball.probe.selection;

import org.carball.probe.model.CandidateRecord;

import java.util.List;

/**
 * Picks the highest-cost records at or above a threshold.
 *
 * <p>Every implementation returns the same members for the same input: at most {@code limit}
 * records with {@code cost >= threshold}, sorted by cost descending. Order among equal costs is
 * unspecified. A {@code limit <= 0} means no limit. Empty input yields an empty list.
 */
public interface SelectionStrategy {

    <T extends CandidateRecord> List<T> select(List<T> candidates, double threshold, int limit);
}
