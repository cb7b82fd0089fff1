package com.questrail.syslog.format;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * SyslogTimestamps
 * -----------------------------------------------------------------------------
 * TIMESTAMP rendering for both header formats.
 *
 * <h2>RFC 3164 §4.1.2</h2>
 * <pre>
 *   Mmm dd hh:mm:ss      e.g. "Oct  7 09:05:01"
 * </pre>
 * English month abbreviation, day space-padded to two characters, 24-hour
 * clock, no year and no zone.
 *
 * <h2>RFC 5424 §6.2.3</h2>
 * <p>RFC 3339 in UTC ({@code Z}). At most six fractional digits are permitted,
 * so readings are floored to whole microseconds. The fraction is omitted when
 * zero and trailing zeros are not written.</p>
 */
final class SyslogTimestamps
{
    private static final DateTimeFormatter RFC3164 = DateTimeFormatter
            .ofPattern("MMM ppd HH:mm:ss", Locale.ENGLISH)
            .withChronology(IsoChronology.INSTANCE);

    private static final DateTimeFormatter RFC3339 = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4, 10, SignStyle.EXCEEDS_PAD)
            .appendLiteral('-')
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendLiteral('-')
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .appendLiteral('T')
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 6, true)
            .appendOffset("+HH:MM", "Z")
            .toFormatter(Locale.ROOT)
            .withChronology(IsoChronology.INSTANCE)
            .withResolverStyle(ResolverStyle.STRICT);

    private SyslogTimestamps() {}

    static String rfc3164(Instant instant, ZoneId zone) {
        return RFC3164.format(instant.atZone(zone));
    }

    static String rfc5424(Instant instant) {
        return RFC3339.format(instant.truncatedTo(ChronoUnit.MICROS).atOffset(ZoneOffset.UTC));
    }
}
