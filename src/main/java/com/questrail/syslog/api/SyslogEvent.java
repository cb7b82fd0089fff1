package com.questrail.syslog.api;

import java.util.Objects;

/**
 * A single event to be rendered by a {@link SyslogFormat}: a severity plus the
 * formatter-specific payload.
 */
public record SyslogEvent<P>(
    Severity severity,
    P payload
) {
    public SyslogEvent {
        Objects.requireNonNull(severity, "severity");
    }
}
