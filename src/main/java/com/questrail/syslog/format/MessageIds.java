package com.questrail.syslog.format;

/**
 * MessageIds
 * -----------------------------------------------------------------------------
 * Normalizes the RFC 5424 MSGID header field.
 *
 * <p>RFC 5424 §6.2.7 restricts MSGID to 1–32 PRINTUSASCII characters
 * (code points 33–126). Non-conforming input is repaired, never rejected:</p>
 * <ol>
 *   <li>{@code null} becomes the NILVALUE</li>
 *   <li>Every code point outside 33–126 is dropped</li>
 *   <li>The survivors are truncated to the first 32</li>
 * </ol>
 *
 * <p>Filtering happens before truncation, so dropped characters do not consume
 * the length budget.</p>
 *
 * <p>An id with no surviving characters also becomes the NILVALUE. Emitting
 * the empty result instead would leave an empty header field (two adjacent
 * spaces), which the RFC 5424 grammar does not allow; this departs from
 * implementations that write the filtered id unconditionally.</p>
 */
final class MessageIds
{
    static final int MAX_LENGTH = 32;

    private static final int PRINTABLE_MIN = 33;
    private static final int PRINTABLE_MAX = 126;

    private MessageIds() {}

    static boolean isPrintableUsAscii(int codePoint) {
        return codePoint >= PRINTABLE_MIN && codePoint <= PRINTABLE_MAX;
    }

    static String normalize(String messageId) {
        if (messageId == null) {
            return StructuredDataEncoder.NILVALUE;
        }

        StringBuilder sb = new StringBuilder(Math.min(messageId.length(), MAX_LENGTH));
        messageId.codePoints()
                .filter(MessageIds::isPrintableUsAscii)
                .limit(MAX_LENGTH)
                .forEach(sb::appendCodePoint);

        return sb.length() == 0 ? StructuredDataEncoder.NILVALUE : sb.toString();
    }
}
