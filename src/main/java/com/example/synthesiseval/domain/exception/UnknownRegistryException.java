package com.example.synthesiseval.domain.exception;

/**
 * Raised when a caller asks for a field registry that was never loaded.
 */
public class UnknownRegistryException extends DomainException {

	/**
	 * Creates the exception and records the requested registry name as part of the message.
	 *
	 * @param name registry name supplied by the caller
	 */
    public UnknownRegistryException(String name) {
        super("Field registry not found: " + name);
    }
}
