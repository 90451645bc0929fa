package com.phillippitts.providerrouter.presentation.exception;

import com.phillippitts.providerrouter.exception.ConfigException;
import com.phillippitts.providerrouter.exception.ProviderCallException;
import com.phillippitts.providerrouter.exception.RoutingExhaustedException;
import com.phillippitts.providerrouter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients on 5xx.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown feature or provider (HTTP 404), invalid configuration (HTTP 400).
     */
    @ExceptionHandler(ConfigException.class)
    ResponseEntity<ApiError> handleConfig(ConfigException ex) {
        String key = LogSanitizer.sanitize(ex.getKey(), 64);
        if (ex.getKind() == ConfigException.Kind.INVALID_CONFIG) {
            LOG.warn("Rejected configuration: key={}, reason={}", key, LogSanitizer.sanitize(ex.getMessage(), 256));
            return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(
                    ex.getClass().getSimpleName(),
                    "Invalid routing configuration",
                    ex.getMessage(),
                    Instant.now()
                ));
        }
        LOG.debug("Lookup failed: kind={}, key={}", ex.getKind(), key);
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.getKind() == ConfigException.Kind.UNKNOWN_FEATURE ? "Unknown feature" : "Unknown provider",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * No eligible provider (HTTP 503). Transient: providers recover over time.
     */
    @ExceptionHandler(RoutingExhaustedException.class)
    ResponseEntity<ApiError> handleExhausted(RoutingExhaustedException ex) {
        LOG.error("Routing exhausted: feature={}", LogSanitizer.sanitize(ex.getFeature(), 64));
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "No provider currently available",
                "Please retry later",
                Instant.now()
            ));
    }

    /**
     * Every attempted upstream provider failed (HTTP 502).
     */
    @ExceptionHandler(ProviderCallException.class)
    ResponseEntity<ApiError> handleProviderCall(ProviderCallException ex) {
        LOG.error("Provider calls failed: feature={}, attempted={}",
                LogSanitizer.sanitize(ex.getFeature(), 64), ex.getAttemptedProviders(), ex);
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Upstream providers failed",
                "Please retry later",
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationFailed", "Invalid request", details, Instant.now()));
    }

    /**
     * Client error - malformed JSON body (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("MalformedRequest", "Invalid request", "Request body could not be parsed",
                Instant.now()));
    }

    /**
     * Client error - missing or mistyped request parameter (HTTP 400).
     */
    @ExceptionHandler({ServletRequestBindingException.class, TypeMismatchException.class})
    ResponseEntity<ApiError> handleBadParameter(Exception ex) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("InvalidParameter", "Invalid request", ex.getMessage(), Instant.now()));
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
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
