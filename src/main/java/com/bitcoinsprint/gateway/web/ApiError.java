package com.bitcoinsprint.gateway.web;

import com.bitcoinsprint.gateway.auth.CallerContext;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;

/**
 * JSON body of every error the gateway produces itself. Backend errors are relayed as-is.
 *
 * @param tier tier label of the caller when it was resolved before the failure
 */
public record ApiError(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId,
        String tier
) {

    public static ApiError of(HttpStatusCode status, String message, HttpServletRequest req, Clock clock) {
        HttpStatus known = HttpStatus.resolve(status.value());
        String reason = known == null ? String.valueOf(status.value()) : known.getReasonPhrase();
        Object caller = req.getAttribute(CallerContext.ATTRIBUTE);
        return new ApiError(
                clock.instant(),
                status.value(),
                reason,
                (message == null || message.isBlank()) ? reason : message,
                req.getRequestURI(),
                MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY),
                caller instanceof CallerContext ctx ? ctx.tierLabel() : null
        );
    }
}
