package com.questrail.syslog.format;

import com.questrail.syslog.model.StructuredData;

import java.util.Map;
import java.util.Objects;

/**
 * StructuredDataEncoder
 * -----------------------------------------------------------------------------
 * Serializes {@link StructuredData} into the RFC 5424 STRUCTURED-DATA field.
 *
 * <pre>
 *   {}                         ->  -
 *   {a: {x: "1"}, b: {}}       ->  [a x="1"][b]
 * </pre>
 *
 * <p>Elements are concatenated with no separator. Each parameter is written as
 * {@code SP name="value"}.</p>
 *
 * <h2>Escaping</h2>
 * <p>{@link Escaping#PERMISSIVE} (the default) writes values verbatim; callers
 * that feed untrusted values must pre-sanitize them. {@link Escaping#STRICT}
 * prefixes {@code "}, {@code \} and {@code ]} with a backslash as required by
 * RFC 5424 §6.3.3.</p>
 */
public final class StructuredDataEncoder
{
    /** RFC 5424 NILVALUE. */
    public static final String NILVALUE = "-";

    public enum Escaping
    {
        /** Values are inserted between the quotes unchanged. */
        PERMISSIVE,
        /** {@code "}, {@code \} and {@code ]} inside values are backslash-escaped. */
        STRICT
    }

    private static final StructuredDataEncoder PERMISSIVE = new StructuredDataEncoder(Escaping.PERMISSIVE);
    private static final StructuredDataEncoder STRICT = new StructuredDataEncoder(Escaping.STRICT);

    private final Escaping escaping;

    private StructuredDataEncoder(Escaping escaping) {
        this.escaping = escaping;
    }

    public static StructuredDataEncoder permissive() {
        return PERMISSIVE;
    }

    public static StructuredDataEncoder strict() {
        return STRICT;
    }

    public static StructuredDataEncoder forEscaping(Escaping escaping) {
        return Objects.requireNonNull(escaping, "escaping") == Escaping.STRICT ? STRICT : PERMISSIVE;
    }

    public Escaping escaping() {
        return escaping;
    }

    public String encode(StructuredData data) {
        Objects.requireNonNull(data, "data");
        if (data.isEmpty()) {
            return NILVALUE;
        }

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Map<String, String>> element : data.elements().entrySet()) {
            sb.append('[').append(element.getKey());
            for (Map.Entry<String, String> param : element.getValue().entrySet()) {
                sb.append(' ').append(param.getKey()).append("=\"");
                appendValue(sb, param.getValue());
                sb.append('"');
            }
            sb.append(']');
        }
        return sb.toString();
    }

    private void appendValue(StringBuilder sb, String value) {
        if (escaping == Escaping.PERMISSIVE) {
            sb.append(value);
            return;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\' || c == ']') {
                sb.append('\\');
            }
            sb.append(c);
        }
    }
}
