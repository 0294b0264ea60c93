package com.example.synthesiseval.domain.model;

import com.example.synthesiseval.domain.exception.UnknownComparatorKindException;

import java.util.Locale;

/**
 * Closed set of comparison strategies a field can be declared with.
 * Dispatch over this enum uses exhaustive {@code switch} expressions, so adding a constant without
 * wiring a comparator fails compilation instead of silently skipping the field.
 */
public enum ComparatorKind {
    EXACT_TEXT("ExactNormalizedText"),
    FORMULA("FormulaMatch"),
    NUMERIC_SET_WITH_TOLERANCE("NumericSetWithTolerance"),
    KEYED_NUMERIC_SERIES("KeyedNumericSeries"),
    SET_OF_STRINGS("SetOfStrings");

    private final String label;

    ComparatorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

	/**
	 * Resolves a kind from configuration or request payloads.
	 * Accepts the enum name ({@code SET_OF_STRINGS}, {@code set-of-strings}) or the label ({@code SetOfStrings}),
	 * case-insensitively.
	 *
	 * @param rawValue kind declared by the caller
	 * @return resolved kind
	 * @throws UnknownComparatorKindException when the value matches no kind
	 */
    public static ComparatorKind fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new UnknownComparatorKindException(rawValue);
        }
        String candidate = rawValue.trim();
        String asConstant = candidate.replace('-', '_').toUpperCase(Locale.ROOT);
        for (ComparatorKind kind : values()) {
            if (kind.name().equals(asConstant) || kind.label.equalsIgnoreCase(candidate)) {
                return kind;
            }
        }
        throw new UnknownComparatorKindException(rawValue);
    }
}
