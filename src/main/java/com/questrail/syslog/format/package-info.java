/**
 * Syslog Wire Formats: RFC 3164 and RFC 5424 encoding
 * =============================================================================
 *
 * <p>This package renders a severity, a facility and a payload into one syslog
 * line. It is a pure encoding layer: it writes bytes to a caller-supplied
 * {@link java.io.OutputStream} and nothing more.</p>
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   (Severity, payload)
 *        → PriorityEncoder          PRI = facility | severity
 *        → SyslogTimestamps         RFC 3164 "Mmm dd hh:mm:ss" / RFC 3339 UTC
 *        → MessageIds               (RFC 5424) filter to PRINTUSASCII, cap at 32
 *        → StructuredDataEncoder    (RFC 5424) [id name="value"]... or "-"
 *        → LineWriter               single UTF-8 write, no newline, no flush
 * </pre>
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>Encoding steps are total: bad input is filtered, truncated or
 *       substituted, never rejected.</li>
 *   <li>The only failure is a sink write error, surfaced as
 *       {@link com.questrail.syslog.api.SyslogFormatException}.</li>
 * </ul>
 *
 * <h2>Out of scope</h2>
 * <p>Transport I/O, line termination and RFC 6587 framing live outside this
 * package (see {@code transport.netty}).</p>
 */
package com.questrail.syslog.format;
