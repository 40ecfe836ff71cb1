package villagecompute.pipelinecontrol.services;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Coarse cost class of a warehouse operation, used to pick a default timeout when the caller supplies none.
 */
public enum OperationShape {

    /**
     * Short single-table SELECT.
     */
    SIMPLE_READ(30),

    /**
     * INSERT, UPDATE, DELETE or MERGE.
     */
    WRITE(60),

    /**
     * Joins, aggregation, window functions or CTEs.
     */
    HEAVY(120),

    /**
     * Not classifiable; gets the tier ceiling.
     */
    UNKNOWN(Integer.MAX_VALUE);

    private static final int SIMPLE_READ_MAX_LENGTH = 100;

    private static final Pattern WRITE_PREFIX = Pattern.compile("^(INSERT|UPDATE|DELETE|MERGE)\\b");

    private static final Pattern HEAVY_MARKER = Pattern.compile("\\bJOIN\\b|\\bGROUP\\s+BY\\b|\\bOVER\\s*\\(|^WITH\\b");

    private final int defaultTimeoutSeconds;

    OperationShape(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public int defaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    /**
     * Classifies a SQL statement by its text.
     *
     * @param statement
     *            SQL text, may be null
     * @return the statement's shape
     */
    public static OperationShape classify(String statement) {
        if (statement == null || statement.isBlank()) {
            return UNKNOWN;
        }
        String normalized = statement.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (WRITE_PREFIX.matcher(normalized).find()) {
            return WRITE;
        }
        if (HEAVY_MARKER.matcher(normalized).find()) {
            return HEAVY;
        }
        if (normalized.startsWith("SELECT") && normalized.length() < SIMPLE_READ_MAX_LENGTH) {
            return SIMPLE_READ;
        }
        return UNKNOWN;
    }
}
