package com.questrail.syslog.transport.netty;

import com.questrail.syslog.api.SyslogEvent;
import com.questrail.syslog.api.SyslogFormat;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * SyslogEventEncoder
 * =============================================================================
 * Netty outbound adapter that renders {@link SyslogEvent}s with a
 * {@link SyslogFormat} and applies the selected {@link SyslogFraming}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure encoding adapter</strong>. It MUST NOT:
 * <ul>
 *   <li>Open, bind or reconnect channels</li>
 *   <li>Retry or buffer failed writes</li>
 *   <li>Filter events by severity</li>
 * </ul>
 *
 * <p>Formatting failures propagate to the pipeline (wrapped by Netty in an
 * {@code EncoderException}). The encoder is stateless and therefore
 * {@link ChannelHandler.Sharable}.</p>
 *
 * @param <P> payload shape of the wrapped formatter
 */
@ChannelHandler.Sharable
public final class SyslogEventEncoder<P> extends MessageToByteEncoder<SyslogEvent<P>>
{
    private static final byte LF = '\n';
    private static final byte SP = ' ';

    private final SyslogFormat<P> format;
    private final SyslogFraming framing;

    public SyslogEventEncoder(SyslogFormat<P> format, SyslogFraming framing)
    {
        this.format = Objects.requireNonNull(format, "format");
        this.framing = Objects.requireNonNull(framing, "framing");
    }

    public SyslogFraming framing()
    {
        return framing;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, SyslogEvent<P> event, ByteBuf out) throws Exception
    {
        switch (framing) {
            case NONE -> formatInto(out, event);
            case NON_TRANSPARENT -> {
                formatInto(out, event);
                out.writeByte(LF);
            }
            case OCTET_COUNTING -> {
                ByteBuf line = ctx.alloc().buffer();
                try {
                    formatInto(line, event);
                    out.writeCharSequence(Integer.toString(line.readableBytes()), StandardCharsets.US_ASCII);
                    out.writeByte(SP);
                    out.writeBytes(line);
                } finally {
                    line.release();
                }
            }
        }
    }

    private void formatInto(ByteBuf buf, SyslogEvent<P> event) throws Exception
    {
        try (ByteBufOutputStream sink = new ByteBufOutputStream(buf)) {
            format.format(sink, event.severity(), event.payload());
        }
    }
}
