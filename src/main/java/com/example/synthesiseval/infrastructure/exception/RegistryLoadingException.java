package com.example.synthesiseval.infrastructure.exception;

/**
 * Signals that a bundled field registry resource could not be read or parsed.
 */
public class RegistryLoadingException extends InfrastructureException {

	/**
	 * @param location registry resource location
	 * @param cause    IO or Jackson failure, {@code null} when the resource is absent
	 */
    public RegistryLoadingException(String location, Throwable cause) {
        super(location,
                (cause == null ? "Field registry resource not found: " : "Unable to read field registry: ") + location,
                cause);
    }
}
