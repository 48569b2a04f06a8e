package io.github.cyfko.dashfilter.core.config;

/**
 * Settings for loading dropdown options from a database-backed value source.
 *
 * @param maxOptions maximum number of distinct values fetched for one selector (default: 500)
 * @param castType   SQL type both sides of a label join are cast to before comparison
 *                   ({@code TEXT} for PostgreSQL, {@code VARCHAR} for H2, {@code CHAR} for MySQL)
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OptionPolicy(
        int maxOptions,
        String castType
) {

    public OptionPolicy {
        if (maxOptions <= 0) {
            throw new IllegalArgumentException("maxOptions must be positive, got: " + maxOptions);
        }
        if (castType == null || !PatternConfig.isSqlIdentifier(castType)) {
            throw new IllegalArgumentException("castType must be a plain SQL type name, got: " + castType);
        }
    }

    public static OptionPolicy defaults() {
        return new OptionPolicy(500, "TEXT");
    }

    /**
     * Settings for MySQL, which has no {@code TEXT} cast target.
     */
    public static OptionPolicy mysql() {
        return new OptionPolicy(500, "CHAR");
    }
}
