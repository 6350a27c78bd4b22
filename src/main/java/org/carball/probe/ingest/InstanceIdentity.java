package org.carball.probe.ingest;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.connection.SqlConnection;
import org.carball.probe.model.RawRow;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identifies the monitored instance on every metric set.
 */
@Slf4j
public record InstanceIdentity(String instanceName, String host) {

    public static final String ENTITY_NAMESPACE = "ms-instance";

    static final String INSTANCE_NAME_QUERY = "SELECT COALESCE(@@SERVERNAME, SERVERPROPERTY('ServerName'), "
            + "SERVERPROPERTY('MachineName')) AS instance_name";

    /**
     * Asks the server for its name, falling back to the connection host.
     */
    public static InstanceIdentity resolve(SqlConnection connection) {
        String host = connection.getHost();
        try {
            List<RawRow> rows = connection.query(INSTANCE_NAME_QUERY);
            if (rows.size() == 1 && rows.get(0).getString("instance_name") != null) {
                return new InstanceIdentity(rows.get(0).getString("instance_name"), host);
            }
            log.warn("Expected one instance name row but got {}; using host {}", rows.size(), host);
        } catch (SQLException | RuntimeException e) {
            log.warn("Could not read instance name, using host {}: {}", host, e.getMessage());
        }
        return new InstanceIdentity(host, host);
    }

    public Map<String, String> attributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("displayName", instanceName);
        attributes.put("entityName", ENTITY_NAMESPACE + ":" + instanceName);
        attributes.put("host", host);
        attributes.put("reportingEndpoint", host);
        return attributes;
    }
}
