package org.carball.probe.connection;

import org.carball.probe.model.RawRow;

import java.sql.SQLException;
import java.util.List;

/**
 * Read-only access to the monitored SQL Server instance.
 *
 * <p>Implementations must allow {@link #query(String)} from two threads at once (the precondition
 * probes run concurrently), which for JDBC means each call borrows its own pooled connection.
 */
public interface SqlConnection extends AutoCloseable {

    /**
     * Runs a fully formatted query and returns every row of its first result set.
     */
    List<RawRow> query(String sql) throws SQLException;

    /**
     * Host name reported alongside every metric set.
     */
    String getHost();

    @Override
    void close();
}
