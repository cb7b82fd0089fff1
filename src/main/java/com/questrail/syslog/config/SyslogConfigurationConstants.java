package com.questrail.syslog.config;

/**
 * Property keys and defaults read by {@link SyslogFormatterConfig#fromProperties}.
 */
public final class SyslogConfigurationConstants
{
    private SyslogConfigurationConstants() {}

    /** POSIX facility name, e.g. {@code user}, {@code daemon}, {@code local3}. */
    public static final String FACILITY = "facility";
    /** user-level messages */
    public static final String DEFAULT_FACILITY = "user";

    /**
     * Zone used for RFC 3164 timestamps: a {@link java.time.ZoneId} string, or
     * {@value #LOCAL_ZONE} for the JVM default zone. Defaults to UTC.
     */
    public static final String RFC3164_TIMEZONE = "rfc3164.timezone";
    public static final String DEFAULT_RFC3164_TIMEZONE = "UTC";
    public static final String LOCAL_ZONE = "local";

    /** {@code permissive} or {@code strict}. */
    public static final String RFC5424_SD_ESCAPING = "rfc5424.structuredData.escaping";
    public static final String DEFAULT_RFC5424_SD_ESCAPING = "permissive";
}
