package io.github.cyfko.dashfilter.core.config;

/**
 * How the target database reads backslashes inside string literals.
 */
public enum StringEscapeStrategy {
    /** Backslash is an ordinary character; only quotes are doubled (PostgreSQL, H2, SQL Server). */
    STANDARD,
    /** Backslash escapes the next character and is doubled as well (MySQL and MariaDB defaults). */
    BACKSLASH
}
