package com.questrail.syslog.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SeverityTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link Severity} codes and lookup by code.
 */
final class SeverityTest
{
    @Test
    void codesFollowDeclarationOrder()
    {
        Severity[] all = Severity.values();
        assertEquals(8, all.length);
        for (int i = 0; i < all.length; i++) {
            assertEquals(i, all[i].code());
        }
        assertEquals(0, Severity.EMERGENCY.code());
        assertEquals(6, Severity.INFO.code());
        assertEquals(7, Severity.DEBUG.code());
    }

    @Test
    void fromCode_resolvesEveryLevel()
    {
        for (Severity severity : Severity.values()) {
            assertSame(severity, Severity.fromCode(severity.code()));
        }
    }

    @Test
    void fromCode_outOfRange_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> Severity.fromCode(-1));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromCode(8));
    }
}
