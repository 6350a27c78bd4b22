package org.carball.probe.binding;

import org.carball.probe.exception.UnknownCategoryException;
import org.carball.probe.model.CandidateRecord;
import org.carball.probe.model.RecordCategory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each record category to the binder for its row shape. Built once per probe.
 */
public class CategoryRegistry {

    private final Map<RecordCategory, RecordBinder<? extends CandidateRecord>> binders;

    public CategoryRegistry(Map<RecordCategory, RecordBinder<? extends CandidateRecord>> binders) {
        this.binders = binders.isEmpty() ? new EnumMap<>(RecordCategory.class) : new EnumMap<>(binders);
    }

    public static CategoryRegistry defaults() {
        Map<RecordCategory, RecordBinder<? extends CandidateRecord>> binders = new EnumMap<>(RecordCategory.class);
        binders.put(RecordCategory.SLOW_QUERY, new SlowQueryBinder());
        binders.put(RecordCategory.WAIT_EVENT, new WaitEventBinder());
        binders.put(RecordCategory.BLOCKING_PAIR, new BlockingPairBinder());
        return new CategoryRegistry(binders);
    }

    public RecordBinder<? extends CandidateRecord> binderFor(RecordCategory category) {
        RecordBinder<? extends CandidateRecord> binder = binders.get(category);
        if (binder == null) {
            throw new UnknownCategoryException(category.getIdentifier());
        }
        return binder;
    }

    /**
     * Resolves a query definition's type identifier, e.g. {@code slowQueries}.
     *
     * @throws UnknownCategoryException when the identifier is not a known category
     */
    public RecordBinder<? extends CandidateRecord> binderFor(String identifier) {
        return binderFor(RecordCategory.fromIdentifier(identifier));
    }
}
