package com.bitcoinsprint.gateway.backend;

import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Header filtering for both directions of a proxied call.
 */
public final class ForwardedHeaders {
    private ForwardedHeaders() {}

    // hop-by-hop (RFC 9110 7.6.1) plus headers the HTTP client computes itself
    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization", "proxy-connection",
            "te", "trailer", "transfer-encoding", "upgrade", "host", "content-length", "expect"
    );

    /** Inbound request headers to send upstream: hop-by-hop and the caller's credential removed. */
    public static HttpHeaders toBackend(HttpHeaders inbound) {
        HttpHeaders out = new HttpHeaders();
        inbound.forEach((name, values) -> {
            String n = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP.contains(n) || n.equals("authorization")) return;
            out.put(name, List.copyOf(values));
        });
        return out;
    }

    /** Backend response headers to relay to the caller. */
    public static HttpHeaders toCaller(HttpHeaders backend) {
        HttpHeaders out = new HttpHeaders();
        backend.forEach((name, values) -> {
            if (HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) return;
            out.put(name, List.copyOf(values));
        });
        return out;
    }
}
