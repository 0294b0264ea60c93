package com.example.synthesiseval.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One extracted (or ground-truth) entity, keyed by its anchor identifier such as a CCDC number.
 * Field values stay raw strings; parsing them is the job of the comparator declared for the field.
 */
public record ExtractionRecord(
        String anchor,
        Map<String, String> fields
) {

    public ExtractionRecord {
        anchor = anchor == null ? "" : anchor.strip();
        Map<String, String> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((key, value) -> copy.put(key, value == null ? "" : value));
        }
        fields = Collections.unmodifiableMap(copy);
    }

    /**
     * @return {@code true} when the record carries no usable anchor and must be ignored
     */
    public boolean hasBlankAnchor() {
        return anchor.isEmpty();
    }

    /**
     * Reads a field value, coercing absent values to the empty string.
     *
     * @param fieldName declared field name
     * @return raw value or {@code ""}
     */
    public String value(String fieldName) {
        return fields.getOrDefault(fieldName, "");
    }
}
