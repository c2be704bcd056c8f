package dev.devanks.solaredge.measurement;

import dev.devanks.solaredge.exception.ResponseParseException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Codec for the API's date formats. Times are sent as site-local wall clock values without an
 * offset, so the zone of the site has to be supplied when parsing.
 */
public final class SiteTimestamps {

    public static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private SiteTimestamps() {
    }

    public static ZonedDateTime dateTime(String field, String raw, ZoneId zone) {
        if (raw == null) {
            throw new ResponseParseException(field, "missing required timestamp");
        }
        try {
            return LocalDateTime.parse(raw, DATE_TIME_FORMAT).atZone(zone);
        } catch (DateTimeParseException e) {
            throw new ResponseParseException(field, "invalid timestamp '" + raw + "'", e);
        }
    }

    public static LocalDate date(String field, String raw) {
        if (raw == null) {
            throw new ResponseParseException(field, "missing required date");
        }
        try {
            return LocalDate.parse(raw, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new ResponseParseException(field, "invalid date '" + raw + "'", e);
        }
    }

    public static Optional<LocalDate> optionalDate(String field, String raw) {
        return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(date(field, raw));
    }

    public static String format(LocalDate date) {
        return DATE_FORMAT.format(date);
    }

    public static String format(LocalDateTime dateTime) {
        return DATE_TIME_FORMAT.format(dateTime);
    }
}
