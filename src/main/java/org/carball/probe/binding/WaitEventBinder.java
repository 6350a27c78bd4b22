package org.carball.probe.binding;

import org.carball.probe.model.RawRow;
import org.carball.probe.model.WaitEventRecord;

/**
 * Binds rows of the wait time analysis definition.
 */
public class WaitEventBinder implements RecordBinder<WaitEventRecord> {

    @Override
    public WaitEventRecord bind(RawRow row) {
        return new WaitEventRecord(
                row.getHex("query_id"),
                row.getString("database_name"),
                TextAnonymizer.cleanAndAnonymize(row.getString("query_text")),
                row.requireString("wait_category"),
                row.getDouble("total_wait_time_ms"),
                row.getDouble("avg_wait_time_ms"),
                row.getLong("wait_event_count"),
                row.getString("last_execution_time"),
                row.getString("collection_timestamp")
        );
    }
}
