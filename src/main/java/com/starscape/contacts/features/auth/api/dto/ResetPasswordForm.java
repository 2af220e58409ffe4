package com.starscape.contacts.features.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.BindParam;

public record ResetPasswordForm(
    @BindParam("new_password")
    @NotBlank(message = "New password is required")
    @Size(min = 6, max = 20, message = "Password must be between 6 and 20 characters")
    String newPassword,
    
    @BindParam("confirm_password")
    @NotBlank(message = "Password confirmation is required")
    String confirmPassword
) {}
