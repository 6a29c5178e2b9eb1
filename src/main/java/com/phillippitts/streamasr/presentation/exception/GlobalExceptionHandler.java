package com.phillippitts.streamasr.presentation.exception;

import com.phillippitts.streamasr.exception.ConnectionException;
import com.phillippitts.streamasr.exception.FrameDecodeException;
import com.phillippitts.streamasr.exception.InvalidAudioException;
import com.phillippitts.streamasr.exception.RemoteServiceException;
import com.phillippitts.streamasr.exception.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid audio", ex.getMessage());
    }

    /**
     * Client error - malformed or invalid request body (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        String details = ex instanceof MethodArgumentNotValidException invalid
                ? invalid.getBindingResult().getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining("; "))
                : "Request body is not valid JSON";
        LOG.warn("Bad request: {}", details);
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid request", details);
    }

    /**
     * Service unreachable or connection dropped - retry possible (HTTP 503).
     */
    @ExceptionHandler({ConnectionException.class, TransportException.class})
    ResponseEntity<ApiError> handleUnavailable(RuntimeException ex) {
        LOG.error("Recognition service unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Recognition service temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Service rejected the session (HTTP 502). The service's own code is passed through.
     */
    @ExceptionHandler(RemoteServiceException.class)
    ResponseEntity<ApiError> handleRemote(RemoteServiceException ex) {
        LOG.error("Recognition service returned code {}: {}", ex.getCode(), ex.getServiceMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getClass().getSimpleName(),
                "Recognition service rejected the request", "Service code " + ex.getCode());
    }

    /**
     * Service answered with a frame that could not be understood (HTTP 502).
     */
    @ExceptionHandler(FrameDecodeException.class)
    ResponseEntity<ApiError> handleDecode(FrameDecodeException ex) {
        LOG.error("Undecodable response from recognition service: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getClass().getSimpleName(),
                "Invalid response from recognition service", "Please retry later");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(code, message, details, Instant.now()));
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
