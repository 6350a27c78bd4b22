package org.carball.probe.binding;

import org.carball.probe.model.BlockingPairRecord;
import org.carball.probe.model.RawRow;

/**
 * Binds rows of the blocking sessions definition. Both sides' query texts are anonymized.
 */
public class BlockingPairBinder implements RecordBinder<BlockingPairRecord> {

    @Override
    public BlockingPairRecord bind(RawRow row) {
        return new BlockingPairRecord(
                row.requireLong("blocking_spid"),
                row.getString("blocking_status"),
                row.requireLong("blocked_spid"),
                row.getString("blocked_status"),
                row.getString("wait_type"),
                row.getDouble("wait_time_in_seconds"),
                row.getString("command_type"),
                row.getString("database_name"),
                TextAnonymizer.anonymize(row.getString("blocking_query_text")),
                TextAnonymizer.anonymize(row.getString("blocked_query_text")),
                row.getString("blocked_query_start_time")
        );
    }
}
