package com.bitcoinsprint.gateway.api;

import com.bitcoinsprint.gateway.backend.BackendClient;
import com.bitcoinsprint.gateway.backend.BackendResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Catch-all: any path not served locally is forwarded to the backend and its answer relayed
 * unchanged, status included.
 */
@RestController
@RequiredArgsConstructor
public class ProxyController {

    private final BackendClient backend;

    @RequestMapping(value = "/**", method = {
            RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE
    })
    public ResponseEntity<byte[]> proxy(HttpServletRequest request,
                                        @RequestHeader HttpHeaders headers,
                                        @RequestBody(required = false) byte[] body) {
        BackendResponse res = backend.forward(
                HttpMethod.valueOf(request.getMethod()),
                targetOf(request),
                headers,
                body
        );
        return ResponseEntity.status(res.status())
                .headers(res.headers())
                .body(res.body());
    }

    // raw (still percent-encoded) path without the context path, plus the query string
    static String targetOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String ctx = request.getContextPath();
        if (ctx != null && !ctx.isEmpty() && uri.startsWith(ctx)) {
            uri = uri.substring(ctx.length());
        }
        String query = request.getQueryString();
        return (query == null || query.isEmpty()) ? uri : uri + "?" + query;
    }
}
