package com.questrail.syslog.api;

/**
 * Severity
 * -----------------------------------------------------------------------------
 * Syslog message severity, ordered by numeric code per RFC 5424 Table 2.
 *
 * <p>The numeric code occupies the low three bits of the PRI value. Lower codes
 * are more severe: {@link #EMERGENCY} is 0, {@link #DEBUG} is 7.</p>
 */
public enum Severity
{
    /** System is unusable. */
    EMERGENCY(0),
    /** Action must be taken immediately. */
    ALERT(1),
    /** Critical conditions. */
    CRITICAL(2),
    /** Error conditions. */
    ERROR(3),
    /** Warning conditions. */
    WARNING(4),
    /** Normal but significant condition. */
    NOTICE(5),
    /** Informational messages. */
    INFO(6),
    /** Debug-level messages. */
    DEBUG(7);

    private final int code;

    Severity(int code) {
        this.code = code;
    }

    /**
     * Returns the numeric severity code (0–7).
     */
    public int code() {
        return code;
    }

    /**
     * Resolves a numeric code back to its severity.
     *
     * @throws IllegalArgumentException if {@code code} is outside 0–7
     */
    public static Severity fromCode(int code) {
        for (Severity severity : values()) {
            if (severity.code == code) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Severity code must be in range 0–7 (was " + code + ")");
    }
}
