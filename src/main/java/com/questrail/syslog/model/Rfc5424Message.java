package com.questrail.syslog.model;

import java.util.Objects;

/**
 * Payload accepted by the RFC 5424 formatter.
 *
 * <p>{@code messageId} may be {@code null}, in which case the NILVALUE is
 * emitted. The id is normalized at format time, not here, so the raw caller
 * value is what this record holds.</p>
 *
 * <p>{@code message} is rendered with {@link String#valueOf(Object)}.</p>
 */
public record Rfc5424Message(
    String messageId,
    StructuredData structuredData,
    Object message
) {
    public Rfc5424Message {
        Objects.requireNonNull(structuredData, "structuredData");
    }

    public static Rfc5424Message of(String messageId, StructuredData structuredData, Object message) {
        return new Rfc5424Message(messageId, structuredData, message);
    }

    /**
     * A message with no MSGID and no STRUCTURED-DATA.
     */
    public static Rfc5424Message of(Object message) {
        return new Rfc5424Message(null, StructuredData.empty(), message);
    }
}
