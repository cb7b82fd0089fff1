package com.questrail.syslog.format;

import com.questrail.syslog.api.SyslogFormatException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes one rendered line to a caller sink as UTF-8 in a single call.
 *
 * <p>No newline is appended and the sink is neither flushed nor closed.</p>
 */
final class LineWriter
{
    private LineWriter() {}

    static void write(OutputStream sink, CharSequence line, String format) throws SyslogFormatException {
        Objects.requireNonNull(sink, "sink");
        byte[] bytes = line.toString().getBytes(StandardCharsets.UTF_8);
        try {
            sink.write(bytes);
        } catch (IOException e) {
            throw new SyslogFormatException(
                    "Failed to write " + format + " syslog line (" + bytes.length + " bytes)", e);
        }
    }
}
