package com.tennis.core.normalize;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads the timestamp shapes sources send. Zone-less values are taken as UTC.
 */
public final class Timestamps {

    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private Timestamps() {
    }

    /**
     * Accepts ISO instants, offset date-times, local date-times, local dates, compact
     * {@code YYYYMMDD} dates and epoch milliseconds.
     */
    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String text = value.trim();

        if (text.matches("\\d{8}")) {
            return tryParse(() -> LocalDate.parse(text, COMPACT_DATE).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (text.matches("\\d{9,}")) {
            return tryParse(() -> Instant.ofEpochMilli(Long.parseLong(text)));
        }

        Optional<Instant> parsed = tryParse(() -> Instant.parse(text));
        if (parsed.isEmpty()) parsed = tryParse(() -> OffsetDateTime.parse(text).toInstant());
        if (parsed.isEmpty()) parsed = tryParse(() -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        if (parsed.isEmpty()) parsed = tryParse(() -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));
        return parsed;
    }

    /**
     * Normalized ISO-8601 instant text, or null when unreadable.
     */
    public static String normalize(String value) {
        return parse(value).map(Instant::toString).orElse(null);
    }

    private static Optional<Instant> tryParse(InstantSupplier supplier) {
        try {
            return Optional.of(supplier.get());
        } catch (DateTimeParseException | ArithmeticException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface InstantSupplier {
        Instant get();
    }
}
