package com.questrail.syslog.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the TIMESTAMP field written into syslog headers.
 *
 * <p>
 * Read once per formatted line. Readings are not used for ordering: two
 * concurrent calls may legitimately stamp out-of-order times.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
