package com.example.synthesiseval.application.exception;

/**
 * Rejection of a use-case call by an application service: the request itself was unusable
 * (no registry, nothing cached to export), as opposed to a broken field declaration.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message reason the call was rejected, safe to return to API clients
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
