package com.questrail.syslog.api;

import java.io.OutputStream;

/**
 * SyslogFormat
 * -----------------------------------------------------------------------------
 * Formatting contract shared by the RFC 3164 and RFC 5424 formatters.
 *
 * <p>The single required operation renders one event at a given
 * {@link Severity} and writes it to a caller-supplied sink. The severity-named
 * operations are conveniences that fix the severity and delegate.</p>
 *
 * <p>Implementations MUST:</p>
 * <ul>
 *   <li>Write exactly one line per call, without a trailing newline</li>
 *   <li>Not flush or close the sink</li>
 *   <li>Not retain the payload after the call returns</li>
 *   <li>Hold no mutable state, so one instance can serve concurrent callers</li>
 * </ul>
 *
 * <p>Line termination and transport framing belong to the transport layer.</p>
 *
 * @param <P> payload shape accepted by the formatter
 */
public interface SyslogFormat<P>
{
    /**
     * Render {@code payload} at {@code severity} and write it to {@code sink}.
     *
     * @throws SyslogFormatException if writing to the sink fails
     */
    void format(OutputStream sink, Severity severity, P payload) throws SyslogFormatException;

    default void emergency(OutputStream sink, P payload) throws SyslogFormatException {
        format(sink, Severity.EMERGENCY, payload);
    }

    default void alert(OutputStream sink, P payload) throws SyslogFormatException {
        format(sink, Severity.ALERT, payload);
    }

    default void critical(OutputStream sink, P payload) throws SyslogFormatException {
        format(sink, Severity.CRITICAL, payload);
    }

    default void error(OutputStream sink, P payload) throws SyslogFormatException {
        format(sink, Severity.ERROR, payload);
    }

    default void warning(OutputStream sink, P payload) throws SyslogFormatException {
        format(sink, Severity.WARNING, payload);
    }

    default void notice(OutputStream sink, P payload) throws SyslogFormatException {
        format(sink, Severity.NOTICE, payload);
    }

    default void info(OutputStream sink, P payload) throws SyslogFormatException {
        format(sink, Severity.INFO, payload);
    }

    default void debug(OutputStream sink, P payload) throws SyslogFormatException {
        format(sink, Severity.DEBUG, payload);
    }
}
