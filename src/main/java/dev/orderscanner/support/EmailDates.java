package dev.orderscanner.support;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient date parsing for values found in email: ISO dates from the
 * extraction model and RFC 1123 Date headers.
 */
public final class EmailDates {

    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*");
    private static final Pattern TRAILING_COMMENT = Pattern.compile("\\s*\\([^)]*\\)\\s*$");

    private EmailDates() {
    }

    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (ISO_DATE_PREFIX.matcher(trimmed).matches()) {
            try {
                return Optional.of(LocalDate.parse(trimmed.substring(0, 10)));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        // "Tue, 2 Jan 2024 10:15:00 +0000 (UTC)"
        String header = TRAILING_COMMENT.matcher(trimmed).replaceFirst("");
        try {
            return Optional.of(ZonedDateTime.parse(header, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
