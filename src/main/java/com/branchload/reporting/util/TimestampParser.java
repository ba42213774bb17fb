package com.branchload.reporting.util;

import lombok.experimental.UtilityClass;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Timestamp parsing for upstream values: "yyyy-MM-dd HH:mm:ss", ISO-8601 with or
 * without an offset, or a bare date. Values without an offset are read in the given zone;
 * values with one are converted into it.
 */
@UtilityClass
public class TimestampParser {

    private static final DateTimeFormatter LENIENT_ISO = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .toFormatter();

    public ZonedDateTime parse(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            throw new DateTimeParseException("Empty datetime value", String.valueOf(value), 0);
        }
        String normalized = value.trim().replace(' ', 'T');
        TemporalAccessor parsed = LENIENT_ISO.parseBest(normalized,
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);

        if (parsed instanceof OffsetDateTime offset) {
            return offset.atZoneSameInstant(zone);
        }
        if (parsed instanceof LocalDateTime local) {
            return local.atZone(zone);
        }
        return ((LocalDate) parsed).atStartOfDay(zone);
    }
}
