package org.carball.probe.testsupport;

import org.carball.probe.connection.SqlConnection;
import org.carball.probe.model.RawRow;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link SqlConnection}: answers each query with the first registered response whose
 * fragment the SQL contains. Safe for the validator's concurrent probes.
 */
public class FakeSqlConnection implements SqlConnection {

    public static final String VERSION_FRAGMENT = "@@VERSION";
    public static final String DATABASES_FRAGMENT = "FROM sys.databases";
    public static final String PERMISSION_FRAGMENT = "VIEW SERVER STATE";
    public static final String LOGIN_FRAGMENT = "IsIntegratedSecurityOnly";
    public static final String INSTANCE_NAME_FRAGMENT = "@@SERVERNAME";

    @FunctionalInterface
    public interface Response {
        List<RawRow> answer() throws SQLException;
    }

    private record Rule(String fragment, Response response) {}

    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private final List<String> executed = new CopyOnWriteArrayList<>();
    private final String host;
    private volatile boolean closed;

    public FakeSqlConnection() {
        this("db-test-01");
    }

    public FakeSqlConnection(String host) {
        this.host = host;
    }

    /**
     * A SQL Server 2019 instance with one Query Store enabled user database, full permissions and mixed mode login.
     */
    public static FakeSqlConnection healthyServer() {
        return new FakeSqlConnection()
                .respond(VERSION_FRAGMENT, row("version",
                        "Microsoft SQL Server 2019 (RTM-CU22) (KB5027702) - 15.0.4322.2 (X64)"))
                .respond(DATABASES_FRAGMENT,
                        row("database_id", 1, "name", "master", "compatibility_level", 150, "is_query_store_on", false),
                        row("database_id", 5, "name", "Orders", "compatibility_level", 150, "is_query_store_on", true))
                .respond(PERMISSION_FRAGMENT, row("has_permission", 1))
                .respond(LOGIN_FRAGMENT, row("login_enabled", 1))
                .respond(INSTANCE_NAME_FRAGMENT, row("instance_name", "SQLPROD01"));
    }

    public static RawRow row(Object... columnsAndValues) {
        Map<String, Object> values = new HashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            values.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new RawRow(values);
    }

    public FakeSqlConnection respond(String fragment, RawRow... rows) {
        return respond(fragment, List.of(rows));
    }

    public FakeSqlConnection respond(String fragment, List<RawRow> rows) {
        return respondWith(fragment, () -> rows);
    }

    public FakeSqlConnection fail(String fragment, String message) {
        return respondWith(fragment, () -> {
            throw new SQLException(message);
        });
    }

    /**
     * Fails the first {@code failures} matching queries, then answers with {@code rows}.
     */
    public FakeSqlConnection failThenRespond(String fragment, int failures, RawRow... rows) {
        AtomicInteger remaining = new AtomicInteger(failures);
        return respondWith(fragment, () -> {
            if (remaining.getAndDecrement() > 0) {
                throw new SQLException("Transient failure");
            }
            return List.of(rows);
        });
    }

    /**
     * Registers a response ahead of all existing ones.
     */
    public FakeSqlConnection override(String fragment, Response response) {
        rules.add(0, new Rule(fragment, response));
        return this;
    }

    public FakeSqlConnection respondWith(String fragment, Response response) {
        rules.add(new Rule(fragment, response));
        return this;
    }

    @Override
    public List<RawRow> query(String sql) throws SQLException {
        if (closed) {
            throw new SQLException("Connection is closed");
        }
        executed.add(sql);
        for (Rule rule : rules) {
            if (sql.contains(rule.fragment())) {
                return rule.response().answer();
            }
        }
        throw new SQLException("No fake response for query: " + sql);
    }

    public List<String> getExecutedQueries() {
        return new ArrayList<>(executed);
    }

    public long countExecuted(String fragment) {
        return executed.stream().filter(sql -> sql.contains(fragment)).count();
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
