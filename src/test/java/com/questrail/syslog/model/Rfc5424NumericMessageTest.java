package com.questrail.syslog.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rfc5424NumericMessageTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link Rfc5424NumericMessage}: the unsigned 32-bit id range
 * and conversion to {@link Rfc5424Message}.
 */
final class Rfc5424NumericMessageTest
{
    @Test
    void toMessage_usesDecimalForm()
    {
        StructuredData sd = StructuredData.builder().addElement("origin").build();

        Rfc5424Message message = Rfc5424NumericMessage.of(42, sd, "m").toMessage();

        assertEquals("42", message.messageId());
        assertSame(sd, message.structuredData());
        assertEquals("m", message.message());
    }

    @Test
    void unsigned32BitRange_isEnforced()
    {
        assertDoesNotThrow(() -> Rfc5424NumericMessage.of(0, StructuredData.empty(), "m"));
        assertEquals("4294967295",
                Rfc5424NumericMessage.of(0xFFFF_FFFFL, StructuredData.empty(), "m").toMessage().messageId());

        assertThrows(IllegalArgumentException.class,
                () -> Rfc5424NumericMessage.of(-1, StructuredData.empty(), "m"));
        assertThrows(IllegalArgumentException.class,
                () -> Rfc5424NumericMessage.of(0x1_0000_0000L, StructuredData.empty(), "m"));
    }

    @Test
    void message_requiresStructuredData()
    {
        assertThrows(NullPointerException.class, () -> Rfc5424Message.of("id", null, "m"));
        assertNull(Rfc5424Message.of("m").messageId());
    }
}
