package com.questrail.syslog.transport.netty;

/**
 * Stream framing applied around each formatted line (RFC 6587).
 */
public enum SyslogFraming
{
    /** The line as-is; suitable for datagram transports (one line per packet). */
    NONE,
    /**
     * Non-transparent framing: the line followed by LF (RFC 6587 §3.4.2).
     *
     * <p>The line is not inspected. An LF inside the message splits it into
     * two frames at the receiver; use {@link #OCTET_COUNTING} when payloads may
     * span multiple lines.</p>
     */
    NON_TRANSPARENT,
    /** Octet counting: {@code MSG-LEN SP line}, MSG-LEN in bytes (RFC 6587 §3.4.1). */
    OCTET_COUNTING
}
