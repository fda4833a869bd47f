package com.farepredict.feature;

import com.farepredict.exception.InvalidTimestampException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;

/**
 * Parses pickup timestamps into the wall-clock date-time they were written in.
 * An offset or zone suffix is accepted but not applied; a bare date means midnight.
 * <p>
 * Layouts are tried in order: ISO dates ({@code 2024-06-15}), year-first slash dates
 * ({@code 2024/06/15}), US month-first slash dates ({@code 06/15/2024}), and the ISO basic
 * form ({@code 20240615T083000}). The first three take an optional {@code T} or space
 * followed by {@code H:mm[:ss[.fraction]]}.
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> LAYOUTS = List.of(
        withOptionalTime(DateTimeFormatter.ISO_LOCAL_DATE),
        withOptionalTime(DateTimeFormatter.ofPattern("uuuu/M/d")),
        withOptionalTime(DateTimeFormatter.ofPattern("M/d/uuuu")),
        basicIso());

    private TimestampParser() {
    }

    public static LocalDateTime parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidTimestampException(text);
        }
        String value = text.trim();
        DateTimeParseException failure = null;
        for (DateTimeFormatter layout : LAYOUTS) {
            try {
                return toWallClock(layout.parse(value));
            } catch (DateTimeParseException ex) {
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        throw new InvalidTimestampException(text, failure);
    }

    private static LocalDateTime toWallClock(TemporalAccessor parsed) {
        LocalDate date = parsed.query(TemporalQueries.localDate());
        LocalTime time = parsed.query(TemporalQueries.localTime());
        return LocalDateTime.of(date, time != null ? time : LocalTime.MIDNIGHT);
    }

    private static DateTimeFormatter withOptionalTime(DateTimeFormatter datePart) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(datePart)
            .optionalStart()
                .optionalStart().appendLiteral('T').optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE)
                .appendLiteral(':')
                .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                .optionalStart()
                    .appendLiteral(':')
                    .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                    .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                .optionalEnd()
                .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
                .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
                .optionalStart().appendLiteral(' ').appendZoneId().optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter basicIso() {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .optionalStart()
                .appendLiteral('T')
                .appendValue(ChronoField.HOUR_OF_DAY, 2)
                .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                .optionalStart().appendValue(ChronoField.SECOND_OF_MINUTE, 2).optionalEnd()
                .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
