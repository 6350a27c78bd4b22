package org.carball.probe.binding;

import java.util.regex.Pattern;

/**
 * Replaces literal values in captured query text so reported SQL carries no user data.
 */
public final class TextAnonymizer {

    public static final String PLACEHOLDER = "?";

    // Single-quoted strings, integer/decimal numbers (including ".99"), double-quoted strings.
    private static final Pattern LITERAL_PATTERN = Pattern.compile("'[^']*'|\\d*\\.?\\d+|\".*?\"");

    // Tags such as /* DMV_POP_1761636289952111000_85288 */ prepended by monitoring tools.
    private static final Pattern DMV_COMMENT_PATTERN = Pattern.compile("^\\s*/\\*\\s*DMV_[^*]*\\*/\\s*");

    private TextAnonymizer() {
        // Utility class - prevent instantiation
    }

    public static String anonymize(String queryText) {
        if (queryText == null) {
            return null;
        }
        return LITERAL_PATTERN.matcher(queryText).replaceAll(PLACEHOLDER);
    }

    public static String removeDmvComments(String queryText) {
        if (queryText == null) {
            return null;
        }
        return DMV_COMMENT_PATTERN.matcher(queryText).replaceFirst("");
    }

    /**
     * Strips a leading DMV tag comment, then anonymizes literals.
     */
    public static String cleanAndAnonymize(String queryText) {
        return anonymize(removeDmvComments(queryText));
    }
}
