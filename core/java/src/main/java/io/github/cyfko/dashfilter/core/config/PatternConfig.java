package io.github.cyfko.dashfilter.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for the names the engine splices into SQL or uses as filter-value keys.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    /** Maximum length of a selector name. */
    public static final int MAX_SELECTOR_NAME_LENGTH = 100;

    /** Maximum length of a selector label, a target column or a target table. */
    public static final int MAX_LABEL_LENGTH = 255;

    /**
     * Selector names key the filter-value map sent by viewers.
     * Example valid: "status", "owner_id", "2024_region"
     */
    public static final Pattern SELECTOR_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_]+$");

    /**
     * SQL identifiers the engine writes into queries unquoted: must start with a letter or underscore.
     * Example valid: "deals", "owner_id", "_tmp". Example invalid: "1col", "owner id", "t.col".
     */
    public static final Pattern SQL_IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    public static boolean isSqlIdentifier(String value) {
        return value != null && SQL_IDENTIFIER_PATTERN.matcher(value).matches();
    }
}
