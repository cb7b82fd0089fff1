package com.questrail.syslog.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * RFC 5424 STRUCTURED-DATA: a mapping of SD-ID to its SD-PARAMs.
 *
 * <h2>Ordering</h2>
 * <p>
 * RFC 5424 treats SD-ELEMENTs as an unordered set. This type keeps insertion
 * order so output is stable for a given instance, but callers must not rely
 * on element or parameter order for meaning.
 * </p>
 *
 * <h2>Validation</h2>
 * <p>
 * Keys and values are stored verbatim. No RFC grammar checks are performed on
 * SD-IDs, parameter names or values; escaping (if any) is applied at encode time.
 * </p>
 */
public final class StructuredData
{
    private static final StructuredData EMPTY = new StructuredData(Map.of());

    private final Map<String, Map<String, String>> elements;

    private StructuredData(Map<String, ? extends Map<String, String>> elements) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        elements.forEach((id, params) -> {
            Map<String, String> paramCopy = new LinkedHashMap<>();
            Objects.requireNonNull(params, "params").forEach((name, value) -> paramCopy.put(
                    Objects.requireNonNull(name, "name"),
                    Objects.requireNonNull(value, "value")));
            copy.put(Objects.requireNonNull(id, "sdId"), Collections.unmodifiableMap(paramCopy));
        });
        this.elements = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns structured data with no elements; encodes to the NILVALUE.
     */
    public static StructuredData empty() {
        return EMPTY;
    }

    /**
     * Copies an existing SD-ID → (name → value) mapping.
     *
     * @throws NullPointerException if any SD-ID, parameter name or value is {@code null}
     */
    public static StructuredData of(Map<String, ? extends Map<String, String>> elements) {
        Objects.requireNonNull(elements, "elements");
        if (elements.isEmpty()) {
            return EMPTY;
        }
        return new StructuredData(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Returns the elements as an unmodifiable SD-ID → (name → value) view.
     */
    public Map<String, Map<String, String>> elements() {
        return elements;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuredData that)) return false;
        return elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "StructuredData" + elements;
    }

    public static final class Builder {
        private final Map<String, Map<String, String>> elements = new LinkedHashMap<>();

        /**
         * Declares an SD-ELEMENT with no parameters (e.g. {@code [origin]}).
         */
        public Builder addElement(String sdId) {
            elements.computeIfAbsent(Objects.requireNonNull(sdId, "sdId"), k -> new LinkedHashMap<>());
            return this;
        }

        /**
         * Adds (or replaces) one parameter of an SD-ELEMENT, creating the element if needed.
         */
        public Builder addParam(String sdId, String name, String value) {
            Objects.requireNonNull(sdId, "sdId");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            elements.computeIfAbsent(sdId, k -> new LinkedHashMap<>()).put(name, value);
            return this;
        }

        public StructuredData build() {
            return elements.isEmpty() ? EMPTY : new StructuredData(elements);
        }
    }
}
