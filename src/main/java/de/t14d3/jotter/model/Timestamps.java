package de.t14d3.jotter.model;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Canonical text form of note and user timestamps: {@code yyyy-MM-dd HH:mm:ss}.
 * <p>
 * The form is fixed width, so comparing two values as strings orders them chronologically.
 * Everything the cache sorts on is in this form.
 */
public final class Timestamps {
    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {
    }

    public static String now(Clock clock) {
        return format(LocalDateTime.now(clock));
    }

    public static String format(LocalDateTime dateTime) {
        return FORMAT.format(dateTime.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Normalize a value read from a JDBC result set. Strings are assumed to be canonical already
     * and only lose a fractional-second suffix.
     */
    public static String fromJdbc(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp timestamp) {
            return format(timestamp.toLocalDateTime());
        }
        if (value instanceof LocalDateTime dateTime) {
            return format(dateTime);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return format(dateTime.toLocalDateTime());
        }
        String text = value.toString();
        int fraction = text.indexOf('.');
        return fraction >= 0 ? text.substring(0, fraction) : text;
    }
}
