package com.starscape.contacts.features.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * OAuth2 password-form login; {@code username} carries the account email.
 */
public record LoginForm(
    @NotBlank(message = "Username is required")
    String username,
    
    @NotBlank(message = "Password is required")
    String password
) {}
