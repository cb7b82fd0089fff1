package com.questrail.syslog.api;

/**
 * Raised when a formatted syslog line could not be written to its sink.
 *
 * <p>This is the only failure mode of formatting. Encoding itself is total:
 * oversized or non-conforming input is filtered, truncated or substituted,
 * never rejected. The cause is always the underlying I/O failure.</p>
 */
public class SyslogFormatException extends Exception
{
    public SyslogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
