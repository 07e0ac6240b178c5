package com.bitcoinsprint.gateway.auth;

import com.bitcoinsprint.gateway.tier.Tier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

@Service
public class ApiKeyHashService {

    static final String KEY_PREFIX = "bitcoin-sprint";
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 16;

    private final SecureRandom secureRandom = new SecureRandom();

    /** Generates {@code bitcoin-sprint-<tier>-<16 random alphanumerics>}. */
    public String generateRawApiKey(Tier tier) {
        StringBuilder sb = new StringBuilder(KEY_PREFIX.length() + 32)
                .append(KEY_PREFIX).append('-').append(tier.wireName()).append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * SHA-256 of the raw key, lowercase hex. Used as the rate-limit identity and in logs,
     * so raw keys never leave the registry.
     */
    public String fingerprint(String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            throw new IllegalArgumentException("rawApiKey must not be blank");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(rawApiKey.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] b) {
        StringBuilder sb = new StringBuilder(b.length * 2);
        for (byte x : b) sb.append(String.format("%02x", x));
        return sb.toString();
    }
}
