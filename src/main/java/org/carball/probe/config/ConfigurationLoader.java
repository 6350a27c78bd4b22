package org.carball.probe.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.probe.selection.SelectionAlgorithm;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves probe and connection settings.
 *
 * <p>Every option has one name, e.g. {@code count-threshold}, spelled {@code --probe.count-threshold}
 * on the command line, {@code PROBE_COUNT_THRESHOLD} in the environment and {@code count-threshold}
 * in the YAML settings file.
 */
@Slf4j
public class ConfigurationLoader {

    static final String CLI_PREFIX = "--probe.";
    static final String ENV_PREFIX = "PROBE_";
    static final String SETTINGS_FILE_OPTION = "settings-file";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads probe settings using the hierarchy: CLI args > env vars > settings file > defaults
     */
    public ProbeSettings loadConfiguration(String[] args) {
        return loadConfiguration(args, System.getenv());
    }

    public ProbeSettings loadConfiguration(String[] args, Map<String, String> env) {
        log.debug("Loading probe configuration");
        ProbeSettings.ProbeSettingsBuilder builder = ProbeSettings.builder();

        resolveOptions(args, env).forEach((option, value) -> applyProbeOption(builder, option, value));

        ProbeSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    public ConnectionSettings loadConnectionSettings(String[] args) {
        return loadConnectionSettings(args, System.getenv());
    }

    public ConnectionSettings loadConnectionSettings(String[] args, Map<String, String> env) {
        ConnectionSettings.ConnectionSettingsBuilder builder = ConnectionSettings.builder();
        resolveOptions(args, env).forEach((option, value) -> applyConnectionOption(builder, option, value));

        ConnectionSettings settings = builder.build();
        if (settings.getUsername() == null || settings.getUsername().isBlank()) {
            log.warn("No username configured; SQL Server authentication will fail");
        }
        log.debug("Connection settings: {}", settings);
        return settings;
    }

    /**
     * Looks up a single option such as {@code query-file}, or null when it is not set anywhere.
     */
    public String resolveOption(String[] args, Map<String, String> env, String option) {
        return resolveOptions(args, env).get(option);
    }

    /**
     * Collects raw option values, later sources overriding earlier ones.
     */
    Map<String, String> resolveOptions(String[] args, Map<String, String> env) {
        Map<String, String> cliOptions = readCliArguments(args);
        Map<String, String> envOptions = readEnvironment(env);

        String settingsFile = cliOptions.getOrDefault(SETTINGS_FILE_OPTION, envOptions.get(SETTINGS_FILE_OPTION));

        Map<String, String> options = new LinkedHashMap<>();
        if (settingsFile != null) {
            options.putAll(readSettingsFile(Path.of(settingsFile)));
        }
        options.putAll(envOptions);
        options.putAll(cliOptions);
        options.remove(SETTINGS_FILE_OPTION);
        return options;
    }

    private Map<String, String> readCliArguments(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith(CLI_PREFIX)) {
                options.put(args[i].substring(CLI_PREFIX.length()), args[i + 1]);
                i++;
            }
        }
        return options;
    }

    private Map<String, String> readEnvironment(Map<String, String> env) {
        Map<String, String> options = new LinkedHashMap<>();
        env.forEach((name, value) -> {
            if (name.startsWith(ENV_PREFIX)) {
                String option = name.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
                options.put(option, value);
            }
        });
        return options;
    }

    private Map<String, String> readSettingsFile(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            JsonNode root = yamlMapper.readTree(reader);
            Map<String, String> options = new LinkedHashMap<>();
            if (root != null && root.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                        options.put(field.getKey(), field.getValue().asText());
                    }
                }
            }
            log.info("Read {} settings from {}", options.size(), path);
            return options;
        } catch (IOException e) {
            log.error("Cannot read settings file {}: {}", path, e.getMessage());
            throw new UncheckedIOException("Cannot read settings file " + path, e);
        }
    }

    private void applyProbeOption(ProbeSettings.ProbeSettingsBuilder builder, String option, String value) {
        try {
            switch (option) {
                case "fetch-interval":
                    builder.fetchIntervalSeconds(Integer.parseInt(value.trim()));
                    break;
                case "count-threshold":
                    builder.countThreshold(Integer.parseInt(value.trim()));
                    break;
                case "response-time-threshold":
                    builder.responseTimeThresholdMs(Integer.parseInt(value.trim()));
                    break;
                case "text-truncate-limit":
                    builder.textTruncateLimit(Integer.parseInt(value.trim()));
                    break;
                case "batch-size":
                    builder.batchSize(Integer.parseInt(value.trim()));
                    break;
                case "retry-attempts":
                    builder.retryAttempts(Integer.parseInt(value.trim()));
                    break;
                case "legacy-mode":
                    builder.legacyMode(Boolean.parseBoolean(value.trim()));
                    break;
                case "algorithm":
                    builder.selectionAlgorithm(SelectionAlgorithm.fromName(value.trim()));
                    break;
                default:
                    break;
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", option, value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: {}", option, e.getMessage());
        }
    }

    private void applyConnectionOption(ConnectionSettings.ConnectionSettingsBuilder builder, String option, String value) {
        try {
            switch (option) {
                case "hostname":
                    builder.hostname(value);
                    break;
                case "port":
                    builder.port(Integer.parseInt(value.trim()));
                    break;
                case "instance":
                    builder.instance(value);
                    break;
                case "username":
                    builder.username(value);
                    break;
                case "password":
                    builder.password(value);
                    break;
                case "database":
                    builder.database(value);
                    break;
                case "timeout":
                    builder.timeoutSeconds(Integer.parseInt(value.trim()));
                    break;
                case "query-timeout":
                    builder.queryTimeoutSeconds(Integer.parseInt(value.trim()));
                    break;
                case "enable-ssl":
                    builder.enableSsl(Boolean.parseBoolean(value.trim()));
                    break;
                case "trust-server-certificate":
                    builder.trustServerCertificate(Boolean.parseBoolean(value.trim()));
                    break;
                case "extra-connection-url-args":
                    builder.extraConnectionUrlArgs(value);
                    break;
                default:
                    break;
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", option, value);
        }
    }

    /**
     * Returns help text for the configuration options.
     */
    public static String getSettingsHelp() {
        return """
            Configuration Options:

            Probe:
              --probe.fetch-interval <sec>          Sampling window in seconds (default 15)
              --probe.count-threshold <num>         Maximum slow queries per cycle (default 20, max 30)
              --probe.response-time-threshold <ms>  Minimum average elapsed time (default 500)
              --probe.text-truncate-limit <num>     Maximum query text length (default 4094)
              --probe.batch-size <num>              Records per telemetry batch (default 600)
              --probe.retry-attempts <num>          Attempts per query (default 3)
              --probe.legacy-mode <true|false>      Accept databases without Query Store
              --probe.algorithm <name>              full-sort, bounded-heap (default) or quickselect

            Connection:
              --probe.hostname <host>               SQL Server host (default 127.0.0.1)
              --probe.port <num>                    Port (default 1433)
              --probe.instance <name>               Named instance (replaces port)
              --probe.username <user>               SQL Server login
              --probe.password <secret>             Login password
              --probe.timeout <sec>                 Connection timeout (default 30)
              --probe.query-timeout <sec>           Per-statement timeout (default 30)
              --probe.enable-ssl <true|false>       Encrypt the connection
              --probe.trust-server-certificate <true|false>
              --probe.extra-connection-url-args <k=v&k2=v2>

            Files:
              --probe.settings-file <path>          YAML file with any of the options above
              --probe.query-file <path>             YAML query definitions (default: bundled)

            Environment Variables:
              PROBE_<OPTION>                        e.g. PROBE_COUNT_THRESHOLD, PROBE_PASSWORD

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Built-in defaults
            """;
    }
}
