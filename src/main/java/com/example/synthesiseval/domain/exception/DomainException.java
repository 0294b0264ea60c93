package com.example.synthesiseval.domain.exception;

/**
 * Root of the errors raised by the scoring model itself, mostly bad field declarations.
 * Comparators never throw for malformed values; only configuration reaches this type.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message what was wrong with the declaration or lookup
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * @param message what was wrong with the declaration or lookup
	 * @param cause   lower-level validation failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
