package io.github.cyfko.dashfilter.core.sql;

import io.github.cyfko.dashfilter.core.config.StringEscapeStrategy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Renders Java values as SQL literals.
 * <p>
 * Strings are single-quoted with embedded quotes doubled (and backslashes doubled under
 * {@link StringEscapeStrategy#BACKSLASH}), numbers and booleans are written bare,
 * dates are written as {@code 'YYYY-MM-DD'}. Anything that is not a scalar is refused: the caller
 * gets an empty result and reports a value-shape problem.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SqlLiterals {

    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}([T ].*)?$");

    private SqlLiterals() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Quotes a string literal: {@code O'Brien} becomes {@code 'O''Brien'}.
     */
    public static String quote(String value) {
        return quote(value, StringEscapeStrategy.STANDARD);
    }

    /**
     * Quotes a string literal for a database reading backslashes as described by {@code strategy}:
     * under {@link StringEscapeStrategy#BACKSLASH}, {@code a\b} becomes {@code 'a\\b'}.
     */
    public static String quote(String value, StringEscapeStrategy strategy) {
        String escaped = strategy == StringEscapeStrategy.BACKSLASH ? value.replace("\\", "\\\\") : value;
        return "'" + escaped.replace("'", "''") + "'";
    }

    /**
     * Escapes the LIKE wildcards of a user value so they match literally. Uses backslash, the default
     * LIKE escape character of PostgreSQL, MySQL and H2.
     */
    public static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    /**
     * Whether the value can be rendered by {@link #scalar(Object)}.
     */
    public static boolean isScalar(Object value) {
        return value instanceof CharSequence
                || value instanceof Character
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Enum<?>
                || value instanceof UUID
                || value instanceof Temporal
                || value instanceof Date;
    }

    /**
     * Renders a scalar value.
     *
     * @param value the value
     * @return the literal, or empty if the value is {@code null}, not a scalar or a non-finite number
     */
    public static Optional<String> scalar(Object value) {
        return scalar(value, StringEscapeStrategy.STANDARD);
    }

    /**
     * Renders a scalar value, quoting text with the given strategy.
     */
    public static Optional<String> scalar(Object value, StringEscapeStrategy strategy) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return number(number);
        }
        if (value instanceof Boolean bool) {
            return Optional.of(bool ? "TRUE" : "FALSE");
        }
        if (value instanceof Enum<?> constant) {
            return Optional.of(quote(constant.name(), strategy));
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof UUID) {
            return Optional.of(quote(value.toString(), strategy));
        }
        if (value instanceof Temporal || value instanceof Date) {
            return temporal(value);
        }
        return Optional.empty();
    }

    /**
     * Renders a value as a date literal {@code 'YYYY-MM-DD'}. Accepts {@code java.time} dates and
     * timestamps, {@link Date} and ISO-8601 strings ({@code 2024-01-31}, {@code 2024-01-31T10:15:00},
     * {@code 2024-01-31T10:15:00Z}). Timestamps keep their calendar date; instants are read in UTC.
     *
     * @param value the value
     * @return the literal, or empty when the value is not a date
     */
    public static Optional<String> date(Object value) {
        return toLocalDate(value).map(d -> quote(d.toString()));
    }

    static Optional<LocalDate> toLocalDate(Object value) {
        if (value instanceof LocalDate localDate) {
            return Optional.of(localDate);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof OffsetDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof ZonedDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant.atOffset(ZoneOffset.UTC).toLocalDate());
        }
        if (value instanceof java.sql.Date sqlDate) {
            return Optional.of(sqlDate.toLocalDate());
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return Optional.of(timestamp.toLocalDateTime().toLocalDate());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant().atOffset(ZoneOffset.UTC).toLocalDate());
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (!ISO_DATE_PREFIX.matcher(trimmed).matches()) {
                return Optional.empty();
            }
            try {
                return Optional.of(LocalDate.parse(trimmed.substring(0, 10)));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<String> number(Number number) {
        if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return Optional.empty();
        }
        if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return Optional.empty();
        }
        if (number instanceof BigDecimal decimal) {
            return Optional.of(decimal.toPlainString());
        }
        if (number instanceof Double || number instanceof Float) {
            return Optional.of(BigDecimal.valueOf(number.doubleValue()).toPlainString());
        }
        if (number instanceof BigInteger || number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return Optional.of(number.toString());
        }
        return Optional.of(new BigDecimal(number.toString()).toPlainString());
    }

    private static Optional<String> temporal(Object value) {
        if (value instanceof LocalDate || value instanceof java.sql.Date) {
            return date(value);
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return Optional.of(quote(timestamp.toLocalDateTime().toString()));
        }
        if (value instanceof Date date) {
            return Optional.of(quote(date.toInstant().toString()));
        }
        return Optional.of(quote(value.toString()));
    }
}
