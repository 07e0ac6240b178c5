package com.bitcoinsprint.gateway.web;

import com.bitcoinsprint.gateway.api.InsufficientTierException;
import com.bitcoinsprint.gateway.api.UnknownTierException;
import com.bitcoinsprint.gateway.backend.BackendUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.time.Clock;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ApiError> handleBackend(BackendUnavailableException ex, HttpServletRequest req) {
        log.warn("Backend unavailable path={} timedOut={}: {}", req.getRequestURI(), ex.isTimedOut(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), req);
    }

    @ExceptionHandler(InsufficientTierException.class)
    public ResponseEntity<ApiError> handleTier(InsufficientTierException ex, HttpServletRequest req) {
        log.warn("Forbidden path={} tier={} required={}", req.getRequestURI(),
                ex.getActual().wireName(), ex.getRequired().wireName());
        return respond(HttpStatus.FORBIDDEN, ex.getMessage(), req);
    }

    @ExceptionHandler(UnknownTierException.class)
    public ResponseEntity<ApiError> handleUnknownTier(UnknownTierException ex, HttpServletRequest req) {
        log.warn("Bad request path={}: {}", req.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentNotValidException.class, BindException.class})
    public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest req) {
        log.warn("Bad request path={}: {}", req.getRequestURI(), ex.getClass().getSimpleName());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body", req);
    }

    @ExceptionHandler({ResponseStatusException.class, HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class, NoResourceFoundException.class})
    public ResponseEntity<ApiError> handleErrorResponse(Exception ex, HttpServletRequest req) {
        ErrorResponse er = (ErrorResponse) ex;
        HttpStatusCode status = er.getStatusCode();
        String detail = er.getBody().getDetail();
        log.warn("Request rejected status={} path={}: {}", status.value(), req.getRequestURI(), detail);
        return ResponseEntity.status(status).body(ApiError.of(status, detail, req, clock));
    }

    /**
     * The caller disconnected while the response was being written. Nothing can be sent;
     * the metrics filter records the request as 499.
     */
    @ExceptionHandler(IOException.class)
    public void handleClientAbort(IOException ex, HttpServletRequest req, HttpServletResponse res) {
        req.setAttribute(RequestContextKeys.CLIENT_CANCELLED_ATTRIBUTE, Boolean.TRUE);
        log.info("Client closed request path={}: {}", req.getRequestURI(), ex.toString());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", req);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String message, HttpServletRequest req) {
        return ResponseEntity.status(status).body(ApiError.of(status, message, req, clock));
    }
}
