package com.questrail.syslog.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyslogFormatTest
 * -----------------------------------------------------------------------------
 * Checks that the severity-named defaults on {@link SyslogFormat} dispatch to
 * {@code format} with the matching {@link Severity}.
 */
final class SyslogFormatTest
{
    private final List<Severity> seen = new ArrayList<>();
    private final List<String> payloads = new ArrayList<>();
    private SyslogFormat<String> recording;

    @BeforeEach
    void setUp()
    {
        recording = (OutputStream sink, Severity severity, String payload) -> {
            seen.add(severity);
            payloads.add(payload);
        };
    }

    @Test
    void severityNamedOperations_delegateWithFixedSeverity() throws Exception
    {
        OutputStream sink = new ByteArrayOutputStream();

        recording.emergency(sink, "0");
        recording.alert(sink, "1");
        recording.critical(sink, "2");
        recording.error(sink, "3");
        recording.warning(sink, "4");
        recording.notice(sink, "5");
        recording.info(sink, "6");
        recording.debug(sink, "7");

        assertEquals(List.of(Severity.values()), seen);
        assertEquals(List.of("0", "1", "2", "3", "4", "5", "6", "7"), payloads);
    }

    @Test
    void formatException_propagatesFromConvenienceOperations()
    {
        SyslogFormat<String> failing = (sink, severity, payload) -> {
            throw new SyslogFormatException("write failed", new IOException("x"));
        };

        assertThrows(SyslogFormatException.class, () -> failing.notice(new ByteArrayOutputStream(), "m"));
    }

    @Test
    void event_requiresSeverity()
    {
        assertThrows(NullPointerException.class, () -> new SyslogEvent<>(null, "x"));
        assertEquals(Severity.INFO, new SyslogEvent<>(Severity.INFO, "x").severity());
    }
}
