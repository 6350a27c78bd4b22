package org.carball.probe.binding;

import org.carball.probe.exception.RowBindException;
import org.carball.probe.model.RawRow;
import org.carball.probe.model.ReportableRecord;

/**
 * Binds one raw result row into a typed record, anonymizing its query-text fields.
 */
public interface RecordBinder<T extends ReportableRecord> {

    /**
     * @throws RowBindException when the row does not have the shape this binder expects
     */
    T bind(RawRow row);
}
