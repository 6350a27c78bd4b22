package org.carball.probe.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.connection.SqlConnection;
import org.carball.probe.exception.RowBindException;
import org.carball.probe.exception.UnsupportedEnvironmentException;
import org.carball.probe.model.DatabaseDetails;
import org.carball.probe.model.RawRow;
import org.carball.probe.model.ValidationResult;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides whether query analysis can run against an instance.
 *
 * <p>The version and database checks run in order and short-circuit. The permission and login-mode
 * probes then run concurrently on a two-thread executor. Any probe that errors counts as failed.
 */
@Slf4j
public class PreconditionValidator implements AutoCloseable {

    static final String VERSION_QUERY = "SELECT @@VERSION AS version";

    static final String DATABASES_QUERY =
            "SELECT database_id, name, compatibility_level, is_query_store_on FROM sys.databases";

    static final String PERMISSION_QUERY = """
            SELECT CASE
                WHEN IS_SRVROLEMEMBER('sysadmin') = 1 OR HAS_PERMS_BY_NAME(NULL, NULL, 'VIEW SERVER STATE') = 1
                THEN 1 ELSE 0
            END AS has_permission""";

    static final String LOGIN_MODE_QUERY = """
            SELECT CASE
                WHEN SERVERPROPERTY('IsIntegratedSecurityOnly') = 0 THEN 1 ELSE 0
            END AS login_enabled""";

    static final int MAX_SYSTEM_DATABASE_ID = 4;
    static final int MIN_LEGACY_COMPATIBILITY_LEVEL = 90;

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public PreconditionValidator() {
        this(Executors.newFixedThreadPool(2, new ProbeThreadFactory()), true);
    }

    public PreconditionValidator(ExecutorService executor) {
        this(executor, false);
    }

    private PreconditionValidator(ExecutorService executor, boolean ownsExecutor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    public ValidationResult check(SqlConnection connection, boolean legacyMode) {
        if (!checkVersion(connection)) {
            return ValidationResult.rejectedAtVersion();
        }
        if (!checkDatabases(connection, legacyMode)) {
            return ValidationResult.rejectedAtDatabases();
        }

        CompletableFuture<Boolean> permission = CompletableFuture.supplyAsync(
                () -> runFlagProbe(connection, "permission", PERMISSION_QUERY, "has_permission"), executor);
        CompletableFuture<Boolean> loginMode = CompletableFuture.supplyAsync(
                () -> runFlagProbe(connection, "login mode", LOGIN_MODE_QUERY, "login_enabled"), executor);

        boolean permissionGranted = permission.join();
        boolean loginModeEnabled = loginMode.join();

        if (!permissionGranted) {
            log.error("Login lacks the VIEW SERVER STATE permission required for query analysis");
        }
        if (!loginModeEnabled) {
            log.error("SQL Server authentication is disabled; query analysis requires mixed mode login");
        }
        return new ValidationResult(true, true, permissionGranted, loginModeEnabled);
    }

    /**
     * Runs every check and returns the aggregate gate.
     */
    public boolean validate(SqlConnection connection, boolean legacyMode) {
        return check(connection, legacyMode).passed();
    }

    /**
     * @throws UnsupportedEnvironmentException when any check fails
     */
    public ValidationResult requireValid(SqlConnection connection, boolean legacyMode) {
        ValidationResult result = check(connection, legacyMode);
        if (!result.passed()) {
            throw new UnsupportedEnvironmentException(result);
        }
        return result;
    }

    private boolean checkVersion(SqlConnection connection) {
        String banner;
        try {
            List<RawRow> rows = connection.query(VERSION_QUERY);
            banner = rows.isEmpty() ? null : rows.get(0).getString("version");
        } catch (SQLException | RuntimeException e) {
            log.error("Could not read server version: {}", e.getMessage());
            return false;
        }

        Optional<ServerVersion> version = ServerVersion.parse(banner);
        if (version.isEmpty()) {
            log.error("Could not parse server version from: {}", banner);
            return false;
        }
        if (!version.get().isSupported()) {
            log.error("Unsupported SQL Server version {}; supported major versions are {}",
                    version.get(), ServerVersion.SUPPORTED_MAJOR_VERSIONS);
            return false;
        }
        log.debug("SQL Server version {} is supported", version.get());
        return true;
    }

    private boolean checkDatabases(SqlConnection connection, boolean legacyMode) {
        List<DatabaseDetails> databases;
        try {
            databases = fetchUserDatabases(connection);
        } catch (SQLException | RuntimeException e) {
            log.error("Could not list databases: {}", e.getMessage());
            return false;
        }

        boolean capable = false;
        for (DatabaseDetails database : databases) {
            if (isCapable(database, legacyMode)) {
                capable = true;
            } else {
                log.debug("Database {} does not support query analysis (compatibility {}, query store {})",
                        database.name(), database.compatibilityLevel(), database.queryStoreOn());
            }
        }
        if (!capable) {
            log.error(legacyMode
                    ? "No user database has a compatibility level above " + MIN_LEGACY_COMPATIBILITY_LEVEL
                    : "Query Store is not enabled on any user database");
        }
        return capable;
    }

    static List<DatabaseDetails> fetchUserDatabases(SqlConnection connection) throws SQLException {
        List<DatabaseDetails> databases = new ArrayList<>();
        for (RawRow row : connection.query(DATABASES_QUERY)) {
            try {
                int databaseId = Math.toIntExact(row.requireLong("database_id"));
                if (databaseId <= MAX_SYSTEM_DATABASE_ID) {
                    continue;
                }
                Integer compatibility = row.getInt("compatibility_level");
                Boolean queryStoreOn = row.getBoolean("is_query_store_on");
                databases.add(new DatabaseDetails(databaseId, row.getString("name"),
                        compatibility == null ? 0 : compatibility,
                        Boolean.TRUE.equals(queryStoreOn)));
            } catch (RowBindException | ArithmeticException e) {
                log.debug("Skipping unreadable sys.databases row {}: {}", row, e.getMessage());
            }
        }
        return databases;
    }

    static boolean isCapable(DatabaseDetails database, boolean legacyMode) {
        if (legacyMode) {
            return database.compatibilityLevel() > MIN_LEGACY_COMPATIBILITY_LEVEL;
        }
        return database.queryStoreOn();
    }

    private boolean runFlagProbe(SqlConnection connection, String probeName, String sql, String column) {
        try {
            List<RawRow> rows = connection.query(sql);
            boolean granted = !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0).getBoolean(column));
            log.debug("{} probe returned {}", probeName, granted);
            return granted;
        } catch (SQLException | RuntimeException e) {
            log.error("{} probe failed: {}", probeName, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    private static final class ProbeThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "precondition-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
