package com.starscape.contacts.features.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token pair in the OAuth2 token-response shape.
 */
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn
) {
    public static TokenResponse bearer(String accessToken, String refreshToken, long expiresInSeconds) {
        return new TokenResponse(accessToken, refreshToken, "bearer", expiresInSeconds);
    }
}
