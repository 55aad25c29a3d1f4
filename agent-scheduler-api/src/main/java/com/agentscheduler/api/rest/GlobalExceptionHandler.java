package com.agentscheduler.api.rest;

import com.agentscheduler.core.exception.InvalidStateTransitionException;
import com.agentscheduler.core.exception.OptimisticLockException;
import com.agentscheduler.core.exception.SchedulerBackendException;
import com.agentscheduler.core.exception.SchedulerException;
import com.agentscheduler.core.exception.TaskForbiddenException;
import com.agentscheduler.core.exception.TaskNotFoundException;
import com.agentscheduler.core.exception.TaskValidationException;
import com.agentscheduler.engine.logging.LoggingContext;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps scheduler exceptions to HTTP status codes with an {@code {errorCode, message}} body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(SchedulerException.class)
    public ResponseEntity<ErrorResponse> handleSchedulerException(SchedulerException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("{} {} failed with {} (trace {})",
                request.getMethod(), request.getRequestURI(), ex.getErrorCode(), traceId(), ex);
        } else {
            log.warn("{} {} rejected with {} (trace {}): {}",
                request.getMethod(), request.getRequestURI(), ex.getErrorCode(), traceId(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("{} {} bad request: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(BAD_REQUEST, "Malformed request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("{} {} failed unexpectedly (trace {})", request.getMethod(), request.getRequestURI(), traceId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(INTERNAL_ERROR, "Internal error"));
    }

    static HttpStatus statusFor(SchedulerException ex) {
        if (ex instanceof TaskValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof TaskNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof TaskForbiddenException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof InvalidStateTransitionException || ex instanceof OptimisticLockException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof SchedulerBackendException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String traceId() {
        String traceId = LoggingContext.getTraceId();
        return traceId == null ? "-" : traceId;
    }

    public record ErrorResponse(String errorCode, String message) {}
}
