package com.example.accountscheduler.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Parsing and formatting of operator-supplied timestamps.
 * <p>
 * Accepted input:
 * - {@code 2026-01-05 04:52}: UTC by definition
 * - ISO-8601 with an explicit offset, e.g. {@code 2026-01-05T06:52:00+02:00} or {@code 2026-01-05T04:52:00Z}
 * <p>
 * ISO-8601 without an offset ({@code 2026-01-05T04:52}) is ambiguous and rejected, never coerced.
 */
public final class UtcTimestamps {

    public static final String OPERATOR_PATTERN = "uuuu-MM-dd HH:mm";

    private static final DateTimeFormatter OPERATOR_FORMAT = DateTimeFormatter.ofPattern(OPERATOR_PATTERN)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern OPERATOR_SHAPE = Pattern.compile("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}");

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss 'UTC'")
            .withZone(ZoneOffset.UTC);

    private UtcTimestamps() {
    }

    /**
     * @throws IllegalArgumentException if the value is blank, malformed or an offset-less ISO timestamp
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timestamp is required");
        }
        var trimmed = value.trim();

        if (OPERATOR_SHAPE.matcher(trimmed).matches()) {
            try {
                return LocalDateTime.parse(trimmed, OPERATOR_FORMAT).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(String.format("Invalid date or time in '%s'", trimmed), e);
            }
        }

        try {
            return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            if (isNaiveIso(trimmed)) {
                throw new IllegalArgumentException(String.format(
                        "Timestamp '%s' has no timezone offset; use '%s' (UTC) or ISO-8601 with an offset such as Z or +02:00",
                        trimmed, OPERATOR_PATTERN));
            }
            throw new IllegalArgumentException(String.format(
                    "Unparseable timestamp '%s'; expected '%s' (UTC) or ISO-8601 with an offset", trimmed, OPERATOR_PATTERN), e);
        }
    }

    /**
     * Human-readable UTC rendering, e.g. {@code 2026-01-05 04:52:00 UTC}
     */
    public static String format(Instant instant) {
        return instant == null ? "-" : DISPLAY_FORMAT.format(instant);
    }

    private static boolean isNaiveIso(String value) {
        try {
            LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
