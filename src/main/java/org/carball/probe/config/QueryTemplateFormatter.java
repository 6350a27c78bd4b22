package org.carball.probe.config;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code ${name}} placeholders in query templates.
 */
public final class QueryTemplateFormatter {

    public static final String INTERVAL_SECONDS = "intervalSeconds";
    public static final String COUNT_THRESHOLD = "countThreshold";
    public static final String RESPONSE_TIME_THRESHOLD_MS = "responseTimeThresholdMs";
    public static final String TEXT_TRUNCATE_LIMIT = "textTruncateLimit";
    public static final String QUERY_ID = "queryId";
    public static final String PLAN_COUNT_LIMIT = "planCountLimit";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z]+)}");

    private QueryTemplateFormatter() {
        // Utility class - prevent instantiation
    }

    /**
     * Values shared by every definition template.
     */
    public static Map<String, Object> valuesFor(ProbeSettings settings) {
        Map<String, Object> values = new HashMap<>();
        values.put(INTERVAL_SECONDS, settings.getFetchIntervalSeconds());
        values.put(COUNT_THRESHOLD, settings.getQueryRowLimit());
        values.put(RESPONSE_TIME_THRESHOLD_MS, settings.getResponseTimeThresholdMs());
        values.put(TEXT_TRUNCATE_LIMIT, settings.getTextTruncateLimit());
        return values;
    }

    /**
     * Values for the execution-plan template, keyed by the correlated query ids.
     */
    public static Map<String, Object> planValuesFor(ProbeSettings settings, String queryIds) {
        Map<String, Object> values = valuesFor(settings);
        values.put(QUERY_ID, queryIds);
        values.put(PLAN_COUNT_LIMIT, settings.getPlanCountLimit());
        return values;
    }

    /**
     * @throws IllegalArgumentException when the template names a placeholder with no value
     */
    public static String format(String template, Map<String, ?> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!values.containsKey(name)) {
                throw new IllegalArgumentException("No value for query placeholder ${" + name + "}");
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(values.get(name))));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
