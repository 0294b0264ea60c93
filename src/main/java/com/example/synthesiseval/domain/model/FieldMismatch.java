package com.example.synthesiseval.domain.model;

/**
 * Debug entry explaining a field that did not score cleanly on a matched anchor.
 * Values are the literal inputs, before any normalization.
 */
public record FieldMismatch(
        String anchor,
        String field,
        String predictedRaw,
        String goldRaw
) {
}
