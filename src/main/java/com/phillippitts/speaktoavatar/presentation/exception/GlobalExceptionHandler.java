package com.phillippitts.speaktoavatar.presentation.exception;

import com.phillippitts.speaktoavatar.exception.ConcurrencyRejectedException;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.OperationTimeoutException;
import com.phillippitts.speaktoavatar.exception.ProtocolException;
import com.phillippitts.speaktoavatar.exception.SessionException;
import com.phillippitts.speaktoavatar.exception.StreamCancelledException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
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
 * Converts domain exceptions to HTTP responses with appropriate status codes. Rejections and
 * timeouts tell the client when retrying makes sense; remote failures are reported without
 * leaking remote payloads.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Join already running or room cooling down - retry later (HTTP 429); join pool full (HTTP 503).
     */
    @ExceptionHandler(ConcurrencyRejectedException.class)
    ResponseEntity<ApiError> handleRejected(ConcurrencyRejectedException ex) {
        LOG.warn("Rejected: room={}, reason={}, remaining={}s", ex.getRoomId(), ex.getReason(), ex.getRemainingSeconds());
        if (ex.getReason() == ConcurrencyRejectedException.Reason.BUSY) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ApiError(
                    "ServerBusy",
                    "Too many joins in flight",
                    ex.getMessage(),
                    Instant.now()
            ));
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (ex.getReason() == ConcurrencyRejectedException.Reason.COOLDOWN) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRemainingSeconds()));
        }
        return builder.body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.getReason() == ConcurrencyRejectedException.Reason.COOLDOWN
                        ? "Room is cooling down after a failed join"
                        : "A join for this room is already in progress",
                ex.getMessage(),
                Instant.now()
        ));
    }

    /**
     * A bounded wait ran out (HTTP 504).
     */
    @ExceptionHandler(OperationTimeoutException.class)
    ResponseEntity<ApiError> handleTimeout(OperationTimeoutException ex) {
        LOG.error("Timed out: operation={}, bound={}ms", ex.getOperation(), ex.getBound().toMillis());
        return ResponseEntity
            .status(HttpStatus.GATEWAY_TIMEOUT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Remote service did not answer in time",
                "Operation '" + ex.getOperation() + "' exceeded " + ex.getBound().toMillis() + "ms",
                Instant.now()
            ));
    }

    /**
     * Remote service unreachable - retry possible (HTTP 503).
     */
    @ExceptionHandler(ConnectionException.class)
    ResponseEntity<ApiError> handleConnection(ConnectionException ex) {
        LOG.error("Connection failed: service={}, reason={}: {}", ex.getService(), ex.getReason(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Remote service temporarily unavailable",
                "service=" + ex.getService() + ", reason=" + ex.getReason() + ". Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Remote service refused the session (HTTP 502).
     */
    @ExceptionHandler(SessionException.class)
    ResponseEntity<ApiError> handleSession(SessionException ex) {
        LOG.error("Session refused: service={}, code={}: {}", ex.getService(), ex.getRemoteCode(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Remote service refused the request",
                "service=" + ex.getService() + ", code=" + ex.getRemoteCode(),
                Instant.now()
            ));
    }

    /**
     * Remote service sent something unreadable (HTTP 502).
     */
    @ExceptionHandler(ProtocolException.class)
    ResponseEntity<ApiError> handleProtocol(ProtocolException ex) {
        LOG.error("Protocol error: code={}: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unexpected response from remote service",
                "See server logs with request ID",
                Instant.now()
            ));
    }

    /**
     * Called off by a leave or reset (HTTP 409).
     */
    @ExceptionHandler(StreamCancelledException.class)
    ResponseEntity<ApiError> handleCancelled(StreamCancelledException ex) {
        LOG.info("Cancelled: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Request was cancelled",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid request: {}", details);
        return badRequest("ValidationError", details);
    }

    /**
     * Client error - unreadable body or bad argument (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), ex.getMessage());
    }

    /**
     * Worker pool saturated - retry possible (HTTP 503).
     */
    @ExceptionHandler(TaskRejectedException.class)
    ResponseEntity<ApiError> handleBusy(TaskRejectedException ex) {
        LOG.warn("Worker pool saturated: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                "ServerBusy",
                "Too many requests in flight",
                "Please retry in a few seconds",
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

    private static ResponseEntity<ApiError> badRequest(String code, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(code, "Invalid request", details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
