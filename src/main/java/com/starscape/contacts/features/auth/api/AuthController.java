package com.starscape.contacts.features.auth.api;

import com.starscape.contacts.common.security.JwtAuthenticationFilter;
import com.starscape.contacts.features.auth.api.dto.EmailRequest;
import com.starscape.contacts.features.auth.api.dto.LoginForm;
import com.starscape.contacts.features.auth.api.dto.MessageResponse;
import com.starscape.contacts.features.auth.api.dto.ResetPasswordForm;
import com.starscape.contacts.features.auth.api.dto.SignupRequest;
import com.starscape.contacts.features.auth.api.dto.SignupResponse;
import com.starscape.contacts.features.auth.api.dto.TokenResponse;
import com.starscape.contacts.features.auth.app.AuthService;
import com.starscape.contacts.features.auth.app.EmailVerificationHandler;
import com.starscape.contacts.features.auth.app.PasswordResetHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
    
    private final AuthService authService;
    private final EmailVerificationHandler emailVerificationHandler;
    private final PasswordResetHandler passwordResetHandler;
    
    public AuthController(
            AuthService authService,
            EmailVerificationHandler emailVerificationHandler,
            PasswordResetHandler passwordResetHandler) {
        this.authService = authService;
        this.emailVerificationHandler = emailVerificationHandler;
        this.passwordResetHandler = passwordResetHandler;
    }
    
    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        SignupResponse response = authService.signup(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
    
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<TokenResponse> login(@Valid @ModelAttribute LoginForm form) {
        return ResponseEntity.ok(authService.login(form));
    }
    
    @GetMapping("/refresh_token")
    public ResponseEntity<TokenResponse> refreshToken(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String refreshToken = JwtAuthenticationFilter.extractBearerToken(authorization);
        return ResponseEntity.ok(authService.refresh(refreshToken));
    }
    
    @GetMapping("/confirmed_email/{token}")
    public ResponseEntity<MessageResponse> confirmedEmail(@PathVariable String token) {
        return ResponseEntity.ok(emailVerificationHandler.confirm(token));
    }
    
    @PostMapping("/verify_by_email")
    public ResponseEntity<MessageResponse> verifyByEmail(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(emailVerificationHandler.requestVerification(request.email()));
    }
    
    @PostMapping("/forgot_password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody EmailRequest request) {
        MessageResponse response = passwordResetHandler.requestReset(request.email());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
    
    @GetMapping("/reset_password_template/{token}")
    public ResponseEntity<String> resetPasswordTemplate(@PathVariable String token) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .body(passwordResetHandler.renderResetPage(token));
    }
    
    @PostMapping(value = "/reset_password/{token}", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<MessageResponse> resetPassword(
            @PathVariable String token,
            @Valid @ModelAttribute ResetPasswordForm form) {
        return ResponseEntity.ok(passwordResetHandler.resetPassword(token, form));
    }
}
