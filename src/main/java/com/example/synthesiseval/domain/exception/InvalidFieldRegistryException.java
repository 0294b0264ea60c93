package com.example.synthesiseval.domain.exception;

/**
 * Raised when a field registry is structurally invalid (missing names, duplicate fields, no fields).
 */
public class InvalidFieldRegistryException extends DomainException {

	/**
	 * @param message description of the broken declaration
	 */
    public InvalidFieldRegistryException(String message) {
        super(message);
    }

	/**
	 * @param message description of the broken declaration
	 * @param cause   parameter validation failure
	 */
    public InvalidFieldRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
