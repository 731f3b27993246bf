package com.stepflow.core.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Timestamp format shared by Wait states and Choice rules: ISO-8601 date-time with an offset,
 * e.g. {@code 2026-01-01T00:00:00Z}.
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * Parse a timestamp.
     * 
     * @return The instant, or empty if the text is not a valid timestamp
     */
    public static Optional<Instant> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isTimestamp(String text) {
        return parse(text).isPresent();
    }

    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
