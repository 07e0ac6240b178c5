package com.bitcoinsprint.gateway.auth;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Derives the rate-limit identity of a caller.
 *
 * <p>Formats:
 * <ul>
 *   <li>{@code apiKey:<sha256>} for callers with a registered key</li>
 *   <li>{@code ip:<address>} for anonymous endpoints</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class CallerIdentityResolver {

    private final ApiKeyHashService hashService;

    public String forApiKey(String rawApiKey) {
        return "apiKey:" + hashService.fingerprint(rawApiKey);
    }

    public String forAddress(HttpServletRequest req) {
        String ip = resolveClientIp(req);
        return "ip:" + (ip == null ? "unknown" : ip);
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String resolveClientIp(HttpServletRequest req) {
        // X-Forwarded-For may contain "client, proxy1, proxy2"
        String xff = header(req, "X-Forwarded-For");
        if (xff != null) {
            int comma = xff.indexOf(',');
            String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
            if (!first.isBlank()) return first;
        }
        String realIp = header(req, "X-Real-IP");
        if (realIp != null) return realIp;

        String ra = req.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? null : ra;
    }
}
