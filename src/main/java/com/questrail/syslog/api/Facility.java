package com.questrail.syslog.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Facility
 * -----------------------------------------------------------------------------
 * Syslog facility codes per RFC 5424 Table 1.
 *
 * <p>Each constant carries its code <em>already shifted</em> into the high bits
 * of the PRI value (facility number × 8), matching the POSIX {@code LOG_*}
 * constants. The PRI value is therefore {@code facility.code() | severity.code()}.</p>
 */
public enum Facility
{
    KERN(0),
    USER(1),
    MAIL(2),
    DAEMON(3),
    AUTH(4),
    SYSLOG(5),
    LPR(6),
    NEWS(7),
    UUCP(8),
    CRON(9),
    AUTHPRIV(10),
    FTP(11),
    NTP(12),
    AUDIT(13),
    ALERT(14),
    CLOCK(15),
    LOCAL0(16),
    LOCAL1(17),
    LOCAL2(18),
    LOCAL3(19),
    LOCAL4(20),
    LOCAL5(21),
    LOCAL6(22),
    LOCAL7(23);

    private static final String POSIX_PREFIX = "log_";

    private final int code;

    Facility(int number) {
        this.code = number << 3;
    }

    /**
     * Returns the shifted facility code (0, 8, 16, ... 184).
     */
    public int code() {
        return code;
    }

    /**
     * Resolves a facility from its POSIX short name.
     *
     * <p>Matching is case-insensitive and tolerates the {@code LOG_} prefix, so
     * {@code "local0"}, {@code "LOCAL0"} and {@code "log_local0"} all resolve to
     * {@link #LOCAL0}.</p>
     *
     * @throws IllegalArgumentException if the name is not a known facility
     */
    public static Facility fromName(String name) {
        Objects.requireNonNull(name, "name");

        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(POSIX_PREFIX)) {
            normalized = normalized.substring(POSIX_PREFIX.length());
        }

        for (Facility facility : values()) {
            if (facility.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return facility;
            }
        }
        throw new IllegalArgumentException("Unknown syslog facility: " + name);
    }
}
