package gr.imsi.athenarc.ahocorasick.experiments.util;

import java.util.Locale;

/**
 * Matcher operation exercised by an experiment run.
 */
public enum SearchMode {
    /**
     * {@code Matcher.match}, dedup markers on shared states.
     */
    MATCH,

    /**
     * {@code Matcher.matchThreadSafe}, optionally from several threads at once.
     */
    THREADSAFE,

    CONTAINS,

    FIRST,

    /**
     * {@code Matcher.findAll}, every occurrence with offsets.
     */
    LOCATE;

    public static SearchMode fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported mode: " + value, e);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
