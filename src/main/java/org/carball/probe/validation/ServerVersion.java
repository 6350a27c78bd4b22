package org.carball.probe.validation;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL Server product version as reported by {@code @@VERSION}.
 */
public record ServerVersion(int major, int minor, int build) {

    // SQL Server 2017, 2019 and 2022
    public static final Set<Integer> SUPPORTED_MAJOR_VERSIONS = Set.of(14, 15, 16);

    private static final Pattern VERSION_PATTERN = Pattern.compile("\\b(\\d+)\\.(\\d+)\\.(\\d+)\\b");

    /**
     * Extracts the first {@code major.minor.build} triple, e.g. from
     * {@code "Microsoft SQL Server 2019 (RTM-CU22) - 15.0.4322.2 (X64)"}.
     */
    public static Optional<ServerVersion> parse(String versionBanner) {
        if (versionBanner == null || versionBanner.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = VERSION_PATTERN.matcher(versionBanner);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ServerVersion(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean isSupported() {
        return SUPPORTED_MAJOR_VERSIONS.contains(major);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + build;
    }
}
