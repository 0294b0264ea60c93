package com.example.synthesiseval.interfaces.api.error;

import java.time.Instant;
import java.util.Map;

/**
 * JSON body returned for every failed API call.
 *
 * @param timestamp when the failure was mapped
 * @param status    HTTP status code, repeated in the body for clients that only log payloads
 * @param error     stable machine-readable code such as {@code REGISTRY_NOT_FOUND}
 * @param message   exception message
 * @param path      request URI
 * @param details   optional extra attributes, {@code null} when there are none
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path, null);
    }

    /**
     * Variant carrying client-facing context, e.g. the comparator kinds a declaration may use.
     *
     * @param status  HTTP status code
     * @param error   stable error code
     * @param message exception message
     * @param path    request URI
     * @param details extra attributes, copied
     * @return error body with details
     */
    public static ErrorResponse withDetails(int status, String error, String message, String path,
                                            Map<String, Object> details) {
        return new ErrorResponse(Instant.now(), status, error, message, path, Map.copyOf(details));
    }
}
