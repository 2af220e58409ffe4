package com.starscape.contacts.common.security;

/**
 * Kinds of token the API issues, carried in the {@code scope} claim so a token of one
 * kind can never be accepted where another is expected.
 */
public enum TokenScope {
    ACCESS("access_token"),
    REFRESH("refresh_token"),
    EMAIL_VERIFICATION("email_token"),
    PASSWORD_RESET("reset_password");

    private final String claimValue;

    TokenScope(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
