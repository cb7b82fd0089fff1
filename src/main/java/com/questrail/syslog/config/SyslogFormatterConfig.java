package com.questrail.syslog.config;

import com.questrail.syslog.api.Facility;
import com.questrail.syslog.format.StructuredDataEncoder;
import com.questrail.syslog.time.SystemWallClock;
import com.questrail.syslog.time.WallClock;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Formatter settings that are independent of host/process identity.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>facility</b>: facility used for every PRI value. Defaults to
 *       {@link Facility#USER}.</li>
 *   <li><b>rfc3164Zone</b>: zone for RFC 3164 timestamps. Defaults to UTC so
 *       output does not vary with the host's zone; use
 *       {@link ZoneId#systemDefault()} for local wall-clock time.</li>
 *   <li><b>structuredDataEscaping</b>: RFC 5424 SD value escaping. Defaults to
 *       {@link StructuredDataEncoder.Escaping#PERMISSIVE}.</li>
 *   <li><b>clock</b>: timestamp source. Defaults to {@link SystemWallClock}.</li>
 * </ul>
 */
public record SyslogFormatterConfig(
    Facility facility,
    ZoneId rfc3164Zone,
    StructuredDataEncoder.Escaping structuredDataEscaping,
    WallClock clock
) {
    public SyslogFormatterConfig {
        Objects.requireNonNull(facility, "facility");
        Objects.requireNonNull(rfc3164Zone, "rfc3164Zone");
        Objects.requireNonNull(structuredDataEscaping, "structuredDataEscaping");
        Objects.requireNonNull(clock, "clock");
    }

    public static SyslogFormatterConfig defaults() {
        return builder().build();
    }

    /**
     * Reads settings from string properties; absent keys take their defaults.
     *
     * @throws IllegalArgumentException if a present value is not recognized
     * @see SyslogConfigurationConstants
     */
    public static SyslogFormatterConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        String facility = properties.getProperty(
                SyslogConfigurationConstants.FACILITY,
                SyslogConfigurationConstants.DEFAULT_FACILITY);
        String zone = properties.getProperty(
                SyslogConfigurationConstants.RFC3164_TIMEZONE,
                SyslogConfigurationConstants.DEFAULT_RFC3164_TIMEZONE);
        String escaping = properties.getProperty(
                SyslogConfigurationConstants.RFC5424_SD_ESCAPING,
                SyslogConfigurationConstants.DEFAULT_RFC5424_SD_ESCAPING);

        return builder()
                .withFacility(Facility.fromName(facility))
                .withRfc3164Zone(parseZone(zone))
                .withStructuredDataEscaping(parseEscaping(escaping))
                .build();
    }

    private static ZoneId parseZone(String value) {
        String trimmed = value.trim();
        if (SyslogConfigurationConstants.LOCAL_ZONE.equalsIgnoreCase(trimmed)) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(trimmed);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid "
                    + SyslogConfigurationConstants.RFC3164_TIMEZONE + ": " + value, e);
        }
    }

    private static StructuredDataEncoder.Escaping parseEscaping(String value) {
        try {
            return StructuredDataEncoder.Escaping.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid "
                    + SyslogConfigurationConstants.RFC5424_SD_ESCAPING + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Facility facility = Facility.USER;
        private ZoneId rfc3164Zone = ZoneOffset.UTC;
        private StructuredDataEncoder.Escaping structuredDataEscaping = StructuredDataEncoder.Escaping.PERMISSIVE;
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withFacility(Facility facility) {
            this.facility = facility;
            return this;
        }

        public Builder withRfc3164Zone(ZoneId zone) {
            this.rfc3164Zone = zone;
            return this;
        }

        public Builder withStructuredDataEscaping(StructuredDataEncoder.Escaping escaping) {
            this.structuredDataEscaping = escaping;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public SyslogFormatterConfig build() {
            return new SyslogFormatterConfig(facility, rfc3164Zone, structuredDataEscaping, clock);
        }
    }
}
