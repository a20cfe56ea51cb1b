package com.satfetch.models;

import java.time.Instant;
import java.util.Map;

// Replaced wholesale on refresh, never mutated
public record Credential(
        Map<String, String> headers,
        Object session,
        String refreshToken,
        Instant issuedAt
) {
    public Credential {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (issuedAt == null) issuedAt = Instant.now();
    }

    public static Credential bearer(String accessToken, String refreshToken) {
        return new Credential(Map.of("Authorization", "Bearer " + accessToken), accessToken, refreshToken, Instant.now());
    }

    public static Credential session(Object session) {
        return new Credential(Map.of(), session, null, Instant.now());
    }
}
