package com.example.synthesiseval.interfaces.api.error;

import com.example.synthesiseval.application.exception.ApplicationException;
import com.example.synthesiseval.application.exception.MetricsExportValidationException;
import com.example.synthesiseval.application.exception.UseCaseValidationException;
import com.example.synthesiseval.domain.exception.DomainException;
import com.example.synthesiseval.domain.exception.InvalidFieldRegistryException;
import com.example.synthesiseval.domain.exception.UnknownComparatorKindException;
import com.example.synthesiseval.domain.exception.UnknownRegistryException;
import com.example.synthesiseval.domain.model.ComparatorKind;
import com.example.synthesiseval.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Arrays;
import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps unknown comparator kinds to a 400 response listing the kinds that are accepted.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UnknownComparatorKindException.class)
    public ResponseEntity<ErrorResponse> handleUnknownComparator(UnknownComparatorKindException ex, HttpServletRequest request) {
        Map<String, Object> details = Map.of("acceptedKinds",
                Arrays.stream(ComparatorKind.values()).map(ComparatorKind::label).toList());
        ErrorResponse response = ErrorResponse.withDetails(HttpStatus.BAD_REQUEST.value(), "CONFIGURATION_ERROR",
                ex.getMessage(), request.getRequestURI(), details);
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Maps structurally invalid field registries to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InvalidFieldRegistryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRegistry(InvalidFieldRegistryException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "CONFIGURATION_ERROR");
    }

    /**
     * Maps {@link UnknownRegistryException} to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UnknownRegistryException.class)
    public ResponseEntity<ErrorResponse> handleUnknownRegistry(UnknownRegistryException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "REGISTRY_NOT_FOUND");
    }

    /**
     * Maps other domain exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    /**
     * Maps metrics export validation exceptions to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MetricsExportValidationException.class)
    public ResponseEntity<ErrorResponse> handleMetricsExportValidation(MetricsExportValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "METRICS_EXPORT_VALIDATION_ERROR");
    }

    /**
     * Maps generic use-case validation exceptions to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    /**
     * Maps unreadable request bodies (malformed JSON, arrays where strings are expected) to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        ErrorResponse response = ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "MALFORMED_REQUEST",
                "Request body could not be parsed.", request.getRequestURI());
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {} (resource {})", request.getRequestURI(), ex.resource(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
