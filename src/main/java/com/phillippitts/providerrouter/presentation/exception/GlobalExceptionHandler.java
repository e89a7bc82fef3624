package com.phillippitts.providerrouter.presentation.exception;

import com.phillippitts.providerrouter.exception.AllProvidersFailedException;
import com.phillippitts.providerrouter.exception.ConfigurationException;
import com.phillippitts.providerrouter.exception.NoProviderAvailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Maps routing exceptions to HTTP responses at the REST boundary.
 * Provider error text is logged, never returned to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Nothing healthy to route to (HTTP 503).
     */
    @ExceptionHandler(NoProviderAvailableException.class)
    ResponseEntity<ApiError> handleNoProvider(NoProviderAvailableException ex) {
        LOG.warn("No provider available: capability={}, considered={}, reason={}",
            ex.getCapability(), ex.getConsideredCandidates(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "No provider available for " + ex.getCapability(),
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Every candidate failed; retry later (HTTP 503).
     */
    @ExceptionHandler(AllProvidersFailedException.class)
    ResponseEntity<ApiError> handleAllFailed(AllProvidersFailedException ex) {
        LOG.error("All providers failed: capability={}, attempts={}", ex.getCapability(), ex.getTrace().size(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "All providers failed for " + ex.getCapability(),
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catalog misconfiguration (HTTP 500).
     */
    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.error("Router configuration error: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Router misconfigured",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid parameter (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Error body returned to API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
