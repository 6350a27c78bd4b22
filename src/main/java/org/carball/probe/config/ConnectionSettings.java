package org.carball.probe.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * Where and how to reach the monitored SQL Server instance.
 */
@Data
@Builder(toBuilder = true)
public class ConnectionSettings {

    @Builder.Default
    private String hostname = "127.0.0.1";

    @Builder.Default
    private int port = 1433;

    // Named instance; when set the port is resolved by the SQL Browser service
    private String instance;

    private String username;

    @ToString.Exclude
    private String password;

    @Builder.Default
    private String database = "master";

    @Builder.Default
    private int timeoutSeconds = 30;

    @Builder.Default
    private int queryTimeoutSeconds = 30;

    @Builder.Default
    private boolean enableSsl = false;

    @Builder.Default
    private boolean trustServerCertificate = false;

    // Extra driver properties as key=value pairs separated by '&' or ';'
    private String extraConnectionUrlArgs;

    public String buildJdbcUrl() {
        StringBuilder url = new StringBuilder("jdbc:sqlserver://").append(hostname);
        if (instance != null && !instance.isBlank()) {
            url.append('\\').append(instance);
        } else {
            url.append(':').append(port);
        }
        url.append(";databaseName=").append(database);
        url.append(";loginTimeout=").append(timeoutSeconds);
        url.append(";encrypt=").append(enableSsl);
        url.append(";trustServerCertificate=").append(trustServerCertificate);
        url.append(";applicationName=mssql-query-probe");

        if (extraConnectionUrlArgs != null && !extraConnectionUrlArgs.isBlank()) {
            for (String pair : extraConnectionUrlArgs.split("[&;]")) {
                if (!pair.isBlank()) {
                    url.append(';').append(pair.trim());
                }
            }
        }
        return url.toString();
    }

    /**
     * Host plus instance or port, for log messages.
     */
    public String getDisplayAddress() {
        if (instance != null && !instance.isBlank()) {
            return hostname + "\\" + instance;
        }
        return hostname + ":" + port;
    }
}
