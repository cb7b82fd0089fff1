package com.questrail.syslog.format;

import com.questrail.syslog.api.Facility;
import com.questrail.syslog.api.Severity;

/**
 * PriorityEncoder
 * -----------------------------------------------------------------------------
 * Computes the PRI value shared by both syslog header formats.
 *
 * <p>RFC 5424 §6.2.1: PRI = facility × 8 + severity. Because
 * {@link Facility#code()} is pre-shifted and severity never exceeds 7, this is
 * a bitwise OR. The result is always in 0–191.</p>
 */
public final class PriorityEncoder
{
    /** Largest representable PRI value (LOCAL7 | DEBUG). */
    public static final int MAX_PRIORITY = 191;

    private PriorityEncoder() {}

    public static int encode(Severity severity, Facility facility) {
        return facility.code() | severity.code();
    }
}
