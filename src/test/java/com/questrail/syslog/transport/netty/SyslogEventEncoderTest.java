package com.questrail.syslog.transport.netty;

import com.questrail.syslog.api.Severity;
import com.questrail.syslog.api.SyslogEvent;
import com.questrail.syslog.api.SyslogFormatException;
import com.questrail.syslog.format.Formatter3164;
import com.questrail.syslog.format.Formatter5424;
import com.questrail.syslog.model.Rfc5424Message;
import com.questrail.syslog.time.FixedWallClock;
import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.EncoderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyslogEventEncoderTest
 * -----------------------------------------------------------------------------
 * Tests for {@link SyslogEventEncoder} on an {@code EmbeddedChannel}, one per
 * {@link SyslogFraming} mode.
 */
final class SyslogEventEncoderTest
{
    private final FixedWallClock clock = FixedWallClock.at("2024-10-07T09:05:01Z");

    private final Formatter3164 rfc3164 = Formatter3164.builder()
            .withHostname("host1")
            .withProcess("myapp")
            .withPid(123)
            .withClock(clock)
            .build();

    private final Formatter5424 rfc5424 = Formatter5424.builder()
            .withHostname("host1")
            .withProcess("myapp")
            .withPid(123)
            .withClock(clock)
            .build();

    private EmbeddedChannel channel;

    @AfterEach
    void tearDown()
    {
        if (channel != null) {
            channel.finishAndReleaseAll();
        }
    }

    private String writeAndRead(Object event)
    {
        assertTrue(channel.writeOutbound(event));
        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    void noFraming_writesBareLine()
    {
        channel = new EmbeddedChannel(new SyslogEventEncoder<>(rfc3164, SyslogFraming.NONE));

        assertEquals("<14>Oct  7 09:05:01 host1 myapp[123]: hello",
                writeAndRead(new SyslogEvent<Object>(Severity.INFO, "hello")));
    }

    @Test
    void nonTransparentFraming_appendsLf()
    {
        channel = new EmbeddedChannel(new SyslogEventEncoder<>(rfc5424, SyslogFraming.NON_TRANSPARENT));

        assertEquals("<11>1 2024-10-07T09:05:01Z host1 myapp 123 - - boom\n",
                writeAndRead(new SyslogEvent<>(Severity.ERROR, Rfc5424Message.of("boom"))));
    }

    @Test
    void octetCounting_prefixesUtf8ByteLength()
    {
        channel = new EmbeddedChannel(new SyslogEventEncoder<>(rfc3164, SyslogFraming.OCTET_COUNTING));

        String line = "<14>Oct  7 09:05:01 host1 myapp[123]: héllo";
        int byteLength = line.getBytes(StandardCharsets.UTF_8).length;
        assertEquals(line.length() + 1, byteLength);

        assertEquals(byteLength + " " + line,
                writeAndRead(new SyslogEvent<Object>(Severity.INFO, "héllo")));
    }

    @Test
    void octetCounting_carriesEmbeddedLfInsideOneFrame()
    {
        channel = new EmbeddedChannel(new SyslogEventEncoder<>(rfc3164, SyslogFraming.OCTET_COUNTING));

        String line = "<14>Oct  7 09:05:01 host1 myapp[123]: first\nsecond";

        assertEquals(line.length() + " " + line,
                writeAndRead(new SyslogEvent<Object>(Severity.INFO, "first\nsecond")));
    }

    @Test
    void nonTransparentFraming_doesNotInspectEmbeddedLf()
    {
        channel = new EmbeddedChannel(new SyslogEventEncoder<>(rfc3164, SyslogFraming.NON_TRANSPARENT));

        assertEquals("<14>Oct  7 09:05:01 host1 myapp[123]: first\nsecond\n",
                writeAndRead(new SyslogEvent<Object>(Severity.INFO, "first\nsecond")));
    }

    @Test
    void eventsAreEncodedIndependently()
    {
        channel = new EmbeddedChannel(new SyslogEventEncoder<>(rfc3164, SyslogFraming.NON_TRANSPARENT));

        String first = writeAndRead(new SyslogEvent<Object>(Severity.INFO, "a"));
        String second = writeAndRead(new SyslogEvent<Object>(Severity.DEBUG, "b"));

        assertTrue(first.startsWith("<14>"));
        assertTrue(second.startsWith("<15>"));
        assertTrue(second.endsWith(": b\n"));
    }

    @Test
    void otherMessages_passThrough()
    {
        channel = new EmbeddedChannel(new SyslogEventEncoder<>(rfc3164, SyslogFraming.NONE));

        assertTrue(channel.writeOutbound("not an event"));
        assertEquals("not an event", channel.readOutbound());
    }

    @Test
    void formatFailure_propagatesAsEncoderException()
    {
        SyslogEventEncoder<String> failing = new SyslogEventEncoder<>(
                (sink, severity, payload) -> {
                    throw new SyslogFormatException("write failed", new IOException("x"));
                },
                SyslogFraming.NONE);
        channel = new EmbeddedChannel(failing);

        EncoderException ex = assertThrows(EncoderException.class,
                () -> channel.writeOutbound(new SyslogEvent<>(Severity.INFO, "x")));
        assertInstanceOf(SyslogFormatException.class, ex.getCause());
    }
}
