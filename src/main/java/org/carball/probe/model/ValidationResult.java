package org.carball.probe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of each precondition probe plus the aggregate gate.
 */
public record ValidationResult(
        boolean versionSupported,
        boolean databaseCapable,
        boolean permissionGranted,
        boolean loginModeEnabled
) {

    public static ValidationResult rejectedAtVersion() {
        return new ValidationResult(false, false, false, false);
    }

    public static ValidationResult rejectedAtDatabases() {
        return new ValidationResult(true, false, false, false);
    }

    public boolean passed() {
        return versionSupported && databaseCapable && permissionGranted && loginModeEnabled;
    }

    /**
     * Names the failed checks. The version and database checks short-circuit, so the checks after
     * them never ran and are not reported.
     */
    public String describeFailures() {
        if (!versionSupported) {
            return "unsupported version";
        }
        if (!databaseCapable) {
            return "no capable database";
        }
        List<String> failures = new ArrayList<>();
        if (!permissionGranted) failures.add("missing VIEW SERVER STATE permission");
        if (!loginModeEnabled) failures.add("SQL Server login disabled");
        return failures.isEmpty() ? "none" : String.join(", ", failures);
    }
}
