package com.questrail.syslog.identity;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyslogIdentityTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link SyslogIdentity} construction and process discovery.
 */
final class SyslogIdentityTest
{
    @Test
    void detect_reportsCurrentProcess()
    {
        SyslogIdentity identity = SyslogIdentity.detect();

        assertEquals(ProcessHandle.current().pid(), identity.pid());
        assertNotNull(identity.process());
        assertFalse(identity.process().contains("/"), identity.process());
        identity.hostname().ifPresent(h -> assertFalse(h.isEmpty()));
    }

    @Test
    void of_nullHostname_isAbsent()
    {
        SyslogIdentity identity = SyslogIdentity.of(null, "app", 1);

        assertEquals(Optional.empty(), identity.hostname());
        assertEquals("app", identity.process());
    }

    @Test
    void executableName_stripsDirectories()
    {
        assertEquals("java", SyslogIdentity.executableName("/usr/lib/jvm/bin/java"));
        assertEquals("app", SyslogIdentity.executableName("app"));
    }

    @Test
    void pidOutsideUnsigned32Bit_isRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> SyslogIdentity.of("h", "p", -1));
        assertThrows(IllegalArgumentException.class, () -> SyslogIdentity.of("h", "p", SyslogIdentity.MAX_PID + 1));
        assertEquals(SyslogIdentity.MAX_PID, SyslogIdentity.checkPid(SyslogIdentity.MAX_PID));
    }

    @Test
    void process_mustNotBeNull()
    {
        assertThrows(NullPointerException.class, () -> SyslogIdentity.of("h", null, 1));
    }
}
