package com.lounge.advisor.util;

import com.lounge.advisor.exception.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Utility class for timestamp conversions of provider payloads.
 *
 * Supports multiple timestamp formats:
 * - ISO 8601 offset date-time (e.g., "2025-03-10T14:05:00-05:00")
 * - ISO 8601 instant (e.g., "2025-03-10T19:05:00Z")
 * - ISO 8601 local date-time, read as UTC (e.g., "2025-03-10T19:05:00")
 * - Unix epoch milliseconds (e.g., "1741633500000")
 */
public final class DataTypeConverter {

    private static final DateTimeFormatter ISO_OFFSET_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final DateTimeFormatter ISO_INSTANT_FORMATTER = DateTimeFormatter.ISO_INSTANT;
    private static final DateTimeFormatter ISO_LOCAL_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    private static final Pattern DEPARTURE_DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private DataTypeConverter() {
    }

    /**
     * Parse a timestamp string into an OffsetDateTime.
     * Attempts multiple parsing strategies in order.
     *
     * @param timestamp the timestamp string to parse
     * @return the parsed date-time, or null when the input is null or blank
     * @throws DateTimeParseException if no strategy can parse the input
     */
    public static OffsetDateTime toOffsetDateTime(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }
        String value = timestamp.trim();
        try {
            return OffsetDateTime.parse(value, ISO_OFFSET_FORMATTER);
        } catch (DateTimeParseException e1) {
            try {
                Instant instant = Instant.from(ISO_INSTANT_FORMATTER.parse(value));
                return instant.atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                try {
                    return LocalDateTime.parse(value, ISO_LOCAL_FORMATTER).atOffset(ZoneOffset.UTC);
                } catch (DateTimeParseException e3) {
                    try {
                        long epochMilli = Long.parseLong(value);
                        return Instant.ofEpochMilli(epochMilli).atOffset(ZoneOffset.UTC);
                    } catch (NumberFormatException e4) {
                        throw new DateTimeParseException(
                                "Unable to parse timestamp: " + timestamp
                                        + ". Tried ISO offset date-time, ISO instant, ISO local date-time"
                                        + " and epoch milliseconds formats.",
                                timestamp, 0);
                    }
                }
            }
        }
    }

    /**
     * Parse a scheduled departure date in YYYY-MM-DD form.
     *
     * @throws ValidationException if the format is wrong or the date does not exist
     */
    public static LocalDate toDepartureDate(String date) {
        if (date == null || !DEPARTURE_DATE_PATTERN.matcher(date.trim()).matches()) {
            throw new ValidationException("Invalid date '" + date + "': expected YYYY-MM-DD");
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date '" + date + "': not a calendar date");
        }
    }
}
