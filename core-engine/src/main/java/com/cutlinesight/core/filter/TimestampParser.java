package com.cutlinesight.core.filter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Lenient parser for the absolute timestamps found in feeds and filter bounds.
 *
 * <p>
 * Accepted forms, tried in order:
 * </p>
 * <ol>
 * <li>ISO-8601 instant or offset date-time: {@code 2024-01-01T10:00:00Z},
 * {@code 2024-01-01T15:00:00+05:00}</li>
 * <li>local date-time with {@code T} or a space, seconds optional:
 * {@code 2024-01-01T10:00}, {@code 2024-01-01 10:00:00}; resolved in the
 * configured zone</li>
 * <li>plain date {@code 2024-01-01}: start of day UTC</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class TimestampParser {

    private final ZoneId localZone;

    /**
     * @param localZone zone applied to timestamps without an offset
     */
    public TimestampParser(ZoneId localZone) {
        this.localZone = Objects.requireNonNull(localZone, "localZone must not be null");
    }

    public static TimestampParser utc() {
        return new TimestampParser(ZoneOffset.UTC);
    }

    /**
     * @param text the timestamp text; may be {@code null}
     * @return the instant, or empty if {@code text} is blank or unparseable
     */
    public Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String s = text.trim();
        return parseOffset(s)
                .or(() -> parseLocal(s))
                .or(() -> parseDate(s));
    }

    private static Optional<Instant> parseOffset(String s) {
        try {
            return Optional.of(OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseLocal(String s) {
        try {
            LocalDateTime local = LocalDateTime.parse(s.replace(' ', 'T'), DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            return Optional.of(local.atZone(localZone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseDate(String s) {
        try {
            return Optional.of(LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE)
                    .atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
