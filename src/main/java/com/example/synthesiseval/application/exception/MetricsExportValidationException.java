package com.example.synthesiseval.application.exception;

/**
 * Thrown when a metrics export is requested but there is nothing to export.
 */
public class MetricsExportValidationException extends UseCaseValidationException {

	/**
	 * Creates a new exception describing why the export request is invalid.
	 *
	 * @param message validation message suitable for display
	 */
    public MetricsExportValidationException(String message) {
        super(message);
    }
}
