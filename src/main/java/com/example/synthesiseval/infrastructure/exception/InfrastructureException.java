package com.example.synthesiseval.infrastructure.exception;

/**
 * Failure of an adapter talking to something outside the process: classpath or file resources,
 * JSON documents. Carries the location that failed so operators can find it in the logs.
 */
public abstract class InfrastructureException extends RuntimeException {

    private final String resource;

	/**
	 * @param resource location of the resource that could not be used
	 * @param message  context about the failure
	 * @param cause    library exception, may be {@code null} when the resource simply does not exist
	 */
    protected InfrastructureException(String resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
