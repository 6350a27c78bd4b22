package org.carball.probe.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.analysis.CycleReport;
import org.carball.probe.analysis.DefinitionReport;
import org.carball.probe.analysis.QueryAnalysisOrchestrator;
import org.carball.probe.config.ConfigurationLoader;
import org.carball.probe.config.ConnectionSettings;
import org.carball.probe.config.ProbeSettings;
import org.carball.probe.config.QueryCatalog;
import org.carball.probe.config.QueryDefinitionLoader;
import org.carball.probe.connection.JdbcSqlConnection;
import org.carball.probe.connection.SqlConnection;
import org.carball.probe.exception.ConnectivityException;
import org.carball.probe.exception.RetryExhaustedException;
import org.carball.probe.ingest.JsonLinesTelemetrySink;
import org.carball.probe.retry.RetryExecutor;
import org.carball.probe.retry.RetryPolicy;
import org.carball.probe.validation.PreconditionValidator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Runs one query analysis cycle against a SQL Server instance. Metric sets go to stdout as JSON lines;
 * progress and logs go to stderr.
 */
@Slf4j
public class QueryProbeCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          SQL Server Query Performance Probe v%s            ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.err.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage();
            return EXIT_OK;
        }

        try {
            ConfigurationLoader loader = new ConfigurationLoader();
            ProbeSettings settings = loader.loadConfiguration(args);
            ConnectionSettings connectionSettings = loader.loadConnectionSettings(args);
            QueryCatalog catalog = loadCatalog(loader.resolveOption(args, System.getenv(), "query-file"));

            System.err.println("🔍 Connecting to " + connectionSettings.getDisplayAddress() + "...");
            try (SqlConnection connection = openConnection(connectionSettings, settings.getRetryAttempts());
                 PreconditionValidator validator = new PreconditionValidator()) {

                QueryAnalysisOrchestrator orchestrator = QueryAnalysisOrchestrator.create(
                        connection, settings, catalog, validator, JsonLinesTelemetrySink.toStdout());
                CycleReport report = orchestrator.runCycle();

                printSummary(report);
                return report.isRejected() ? EXIT_FAILURE : EXIT_OK;
            }
        } catch (ConnectivityException e) {
            System.err.println("\n❌ Connection error: " + e.getMessage());
            log.debug("Connection error details", e);
            return EXIT_FAILURE;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_FAILURE;
        }
    }

    private static QueryCatalog loadCatalog(String queryFile) throws IOException {
        QueryDefinitionLoader definitionLoader = new QueryDefinitionLoader();
        return queryFile == null ? definitionLoader.loadDefault() : definitionLoader.load(Path.of(queryFile));
    }

    static SqlConnection openConnection(ConnectionSettings connectionSettings, int attempts) {
        RetryExecutor retry = new RetryExecutor(new RetryPolicy(attempts));
        try {
            return retry.execute("Connect to " + connectionSettings.getDisplayAddress(),
                    () -> JdbcSqlConnection.open(connectionSettings));
        } catch (RetryExhaustedException e) {
            throw new ConnectivityException("Unable to connect to " + connectionSettings.getDisplayAddress()
                    + " after " + e.getAttempts() + " attempts", e.getCause());
        }
    }

    private static void printSummary(CycleReport report) {
        if (report.isRejected()) {
            System.err.println("\n❌ " + report.getSummary());
            return;
        }
        System.err.println("\n📊 Query analysis summary:");
        for (DefinitionReport definition : report.definitions()) {
            String status = switch (definition.outcome()) {
                case COMPLETED -> "✓";
                case SKIPPED -> "-";
                case FAILED -> "✗";
            };
            System.err.printf("   %s %-32s rows: %d, ingested: %d%s%n", status, definition.eventName(),
                    definition.rowsFetched(), definition.recordsIngested(),
                    definition.failure() == null ? "" : " (" + definition.failure() + ")");
        }
        System.err.println("\n✅ " + report.getSummary());
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") || Arrays.asList(args).contains("-h");
    }

    private static void printUsage() {
        System.err.println("""
            Usage: java -jar mssql-query-probe.jar [options]

            Connects to SQL Server, checks that query analysis is possible, then reports
            slow queries, wait statistics, blocking sessions and execution plans as JSON lines.

            Examples:
              java -jar mssql-query-probe.jar --probe.hostname db01 --probe.username probe --probe.password secret
              PROBE_PASSWORD=secret java -jar mssql-query-probe.jar --probe.settings-file probe.yml
            """);
        System.err.println(ConfigurationLoader.getSettingsHelp());
    }
}
