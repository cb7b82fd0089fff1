package com.questrail.syslog.model;

import java.util.Objects;

/**
 * RFC 5424 payload whose MSGID is an unsigned 32-bit integer.
 *
 * <p>This is an input convenience only: it is converted to an
 * {@link Rfc5424Message} carrying the decimal string form before formatting,
 * so both shapes produce byte-identical output for the same id.</p>
 */
public record Rfc5424NumericMessage(
    long messageId,
    StructuredData structuredData,
    Object message
) {
    /** Largest MSGID representable as an unsigned 32-bit integer. */
    public static final long MAX_MESSAGE_ID = 0xFFFF_FFFFL;

    public Rfc5424NumericMessage {
        if (messageId < 0 || messageId > MAX_MESSAGE_ID) {
            throw new IllegalArgumentException(
                    "messageId must be in range 0–" + MAX_MESSAGE_ID + " (was " + messageId + ")");
        }
        Objects.requireNonNull(structuredData, "structuredData");
    }

    public static Rfc5424NumericMessage of(long messageId, StructuredData structuredData, Object message) {
        return new Rfc5424NumericMessage(messageId, structuredData, message);
    }

    public Rfc5424Message toMessage() {
        return new Rfc5424Message(Long.toString(messageId), structuredData, message);
    }
}
