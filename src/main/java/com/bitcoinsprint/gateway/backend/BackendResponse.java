package com.bitcoinsprint.gateway.backend;

import org.springframework.http.HttpHeaders;

public record BackendResponse(int status, HttpHeaders headers, byte[] body) {

    public boolean is2xx() {
        return status >= 200 && status < 300;
    }
}
