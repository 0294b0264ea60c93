package com.example.synthesiseval.application.exception;

/**
 * A use-case input failed validation before any scoring ran.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
