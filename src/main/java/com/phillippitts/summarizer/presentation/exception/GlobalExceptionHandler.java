package com.phillippitts.summarizer.presentation.exception;

import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.exception.DownloadInProgressException;
import com.phillippitts.summarizer.exception.HttpStatusException;
import com.phillippitts.summarizer.exception.InferenceException;
import com.phillippitts.summarizer.exception.InsufficientDiskSpaceException;
import com.phillippitts.summarizer.exception.NetworkException;
import com.phillippitts.summarizer.exception.NotRunningException;
import com.phillippitts.summarizer.exception.PortConflictException;
import com.phillippitts.summarizer.exception.StartupTimeoutException;
import com.phillippitts.summarizer.exception.SummarizerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Backend response bodies and prompt text never reach the client.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Invalid or incomplete settings (HTTP 400).
     */
    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.warn("Configuration error: setting={}, message={}", ex.getSetting(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid inference configuration", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", "Check the request body");
    }

    /**
     * Conflicting state: download already running, or port held by a foreign process (HTTP 409).
     */
    @ExceptionHandler({DownloadInProgressException.class, PortConflictException.class})
    ResponseEntity<ApiError> handleConflict(SummarizerException ex) {
        LOG.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Operation conflicts with current state", ex.getMessage());
    }

    @ExceptionHandler(InsufficientDiskSpaceException.class)
    ResponseEntity<ApiError> handleDiskSpace(InsufficientDiskSpaceException ex) {
        LOG.warn("Insufficient disk space: asset={}, available={}, required={}",
                ex.getAssetId(), ex.getAvailableBytes(), ex.getRequiredBytes());
        return error(HttpStatus.INSUFFICIENT_STORAGE, ex, "Not enough disk space", ex.getMessage());
    }

    /**
     * Upstream backend answered with an error or could not be reached (HTTP 502).
     */
    @ExceptionHandler({HttpStatusException.class, NetworkException.class})
    ResponseEntity<ApiError> handleUpstream(SummarizerException ex) {
        LOG.error("Upstream failure: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex, "Inference backend failed", "Check the backend and retry");
    }

    /**
     * Bundled server not serving (HTTP 503).
     */
    @ExceptionHandler({NotRunningException.class, StartupTimeoutException.class})
    ResponseEntity<ApiError> handleUnavailable(SummarizerException ex) {
        LOG.warn("Bundled server unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Bundled AI engine unavailable",
                "Please retry in a few seconds");
    }

    /**
     * Transient inference error - retry possible (HTTP 503).
     */
    @ExceptionHandler(InferenceException.class)
    ResponseEntity<ApiError> handleInference(InferenceException ex) {
        LOG.error("Inference failed: backend={}", ex.getBackendName(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Summary generation temporarily unavailable",
                "Please retry in a few seconds");
    }

    @ExceptionHandler(SummarizerException.class)
    ResponseEntity<ApiError> handleDomain(SummarizerException ex) {
        LOG.error("Request failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Request failed", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). Framework errors keep their own status.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            return ResponseEntity.status(status)
                    .body(new ApiError(ex.getClass().getSimpleName(), "Request failed", "", Instant.now()));
        }
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

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
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
