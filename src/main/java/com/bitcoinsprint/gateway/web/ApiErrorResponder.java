package com.bitcoinsprint.gateway.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;

/**
 * Writes an {@link ApiError} from inside a filter, where {@code @RestControllerAdvice} does not apply.
 */
@Component
@RequiredArgsConstructor
public class ApiErrorResponder {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void write(HttpServletRequest request, HttpServletResponse response,
                      HttpStatus status, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        byte[] body = objectMapper.writeValueAsBytes(ApiError.of(status, message, request, clock));
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }
}
