package com.bitcoinsprint.gateway.auth;

import java.util.Optional;

public final class BearerTokenExtractor {
    private BearerTokenExtractor() {}

    private static final String SCHEME = "Bearer";

    /**
     * Returns the credential of an {@code Authorization: Bearer <token>} header value.
     * Empty when the header is absent, uses another scheme, or the token is blank or contains whitespace.
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) return Optional.empty();
        String v = authorizationHeader.trim();
        if (v.length() <= SCHEME.length() || !v.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            return Optional.empty();
        }
        if (!Character.isWhitespace(v.charAt(SCHEME.length()))) return Optional.empty();

        String token = v.substring(SCHEME.length()).trim();
        if (token.isEmpty()) return Optional.empty();
        for (int i = 0; i < token.length(); i++) {
            if (Character.isWhitespace(token.charAt(i))) return Optional.empty();
        }
        return Optional.of(token);
    }
}
