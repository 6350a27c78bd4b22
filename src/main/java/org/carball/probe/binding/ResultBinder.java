package org.carball.probe.binding;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.exception.RowBindException;
import org.carball.probe.model.CandidateRecord;
import org.carball.probe.model.RawRow;
import org.carball.probe.model.RecordCategory;
import org.carball.probe.model.ReportableRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds result rows best-effort: a row that fails to bind is logged and skipped, the rest still bind.
 */
@Slf4j
public class ResultBinder {

    private final CategoryRegistry registry;

    public ResultBinder(CategoryRegistry registry) {
        this.registry = registry;
    }

    public BindingResult bind(RecordCategory category, List<RawRow> rows) {
        RecordBinder<? extends CandidateRecord> binder = registry.binderFor(category);
        List<CandidateRecord> records = new ArrayList<>(rows.size());
        List<String> correlationKeys = new ArrayList<>();
        int skipped = 0;

        for (int i = 0; i < rows.size(); i++) {
            CandidateRecord record;
            try {
                record = binder.bind(rows.get(i));
            } catch (RowBindException e) {
                skipped++;
                log.debug("Could not bind {} row {}: {}", category.getIdentifier(), i, e.getMessage());
                continue;
            }
            records.add(record);
            if (category.isSelectionApplied() && record.correlationKey() != null) {
                correlationKeys.add(record.correlationKey());
            }
        }

        if (skipped > 0) {
            log.warn("Skipped {} of {} {} rows that could not be bound", skipped, rows.size(), category.getIdentifier());
        }
        return new BindingResult(category, records, correlationKeys, skipped);
    }

    /**
     * Binds rows with a binder outside the category registry, such as execution plans.
     */
    public <T extends ReportableRecord> List<T> bindAll(RecordBinder<T> binder, List<RawRow> rows) {
        List<T> records = new ArrayList<>(rows.size());
        for (RawRow row : rows) {
            try {
                records.add(binder.bind(row));
            } catch (RowBindException e) {
                log.debug("Could not bind row {}: {}", row, e.getMessage());
            }
        }
        return records;
    }
}
