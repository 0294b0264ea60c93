package com.example.synthesiseval.domain.model;

import com.example.synthesiseval.domain.exception.InvalidFieldRegistryException;

/**
 * Untyped, data-only form of a {@link FieldSpec} as it appears in registry files and request payloads.
 * Omitted parameters fall back to the {@link ComparatorParams} defaults.
 */
public record FieldDeclaration(
        String name,
        String kind,
        Integer tolerance,
        Integer decimalPrecision,
        String delimiter
) {

	/**
	 * Resolves the declared kind and parameters.
	 *
	 * @return typed field specification
	 * @throws com.example.synthesiseval.domain.exception.UnknownComparatorKindException when the kind is unknown
	 * @throws InvalidFieldRegistryException when a parameter is out of range or the delimiter is not a valid pattern
	 */
    public FieldSpec toSpec() {
        ComparatorKind resolvedKind = ComparatorKind.fromString(kind);
        ComparatorParams params = ComparatorParams.DEFAULTS;
        try {
            if (tolerance != null) {
                params = params.withTolerance(tolerance);
            }
            if (decimalPrecision != null) {
                params = params.withDecimalPrecision(decimalPrecision);
            }
            if (delimiter != null && !delimiter.isEmpty()) {
                params = params.withDelimiter(delimiter);
            }
        } catch (IllegalArgumentException ex) {
            throw new InvalidFieldRegistryException("Invalid parameters for field '" + name + "': " + ex.getMessage(), ex);
        }
        return new FieldSpec(name, resolvedKind, params);
    }
}
