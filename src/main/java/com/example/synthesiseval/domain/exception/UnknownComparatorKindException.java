package com.example.synthesiseval.domain.exception;

/**
 * Raised when a field declaration names a comparator kind that is not part of the comparator registry.
 * This is a configuration error; the field is never silently skipped.
 */
public class UnknownComparatorKindException extends DomainException {

	/**
	 * Creates the exception and echoes the offending kind so the declaration can be fixed.
	 *
	 * @param kind raw kind value from configuration or the request
	 */
    public UnknownComparatorKindException(String kind) {
        super("Unknown comparator kind: " + (kind == null || kind.isBlank() ? "<empty>" : "'" + kind + "'"));
    }
}
