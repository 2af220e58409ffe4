package com.starscape.contacts.features.auth.app;

import com.starscape.contacts.common.exception.InvalidTokenException;
import com.starscape.contacts.common.exception.UnprocessableEntityException;
import com.starscape.contacts.common.security.JwtTokenProvider;
import com.starscape.contacts.common.security.TokenScope;
import com.starscape.contacts.common.web.HtmlTemplates;
import com.starscape.contacts.features.auth.api.dto.MessageResponse;
import com.starscape.contacts.features.auth.api.dto.ResetPasswordForm;
import com.starscape.contacts.features.auth.domain.User;
import com.starscape.contacts.features.auth.domain.UserRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Handler for the forgot-password flow: issuing reset mails, serving the reset form
 * and applying the new password. A reset token works once; its {@code jti} must match
 * the reset request stored on the user.
 */
@Service
public class PasswordResetHandler {
    
    private static final Logger log = LoggerFactory.getLogger(PasswordResetHandler.class);
    
    static final String RESET_PAGE_TEMPLATE = "reset_password.html";
    
    private final UserRepository userRepository;
    private final JwtTokenProvider tokenProvider;
    private final PasswordEncoder passwordEncoder;
    private final HtmlTemplates templates;
    
    public PasswordResetHandler(
            UserRepository userRepository,
            JwtTokenProvider tokenProvider,
            PasswordEncoder passwordEncoder,
            HtmlTemplates templates) {
        this.userRepository = userRepository;
        this.tokenProvider = tokenProvider;
        this.passwordEncoder = passwordEncoder;
        this.templates = templates;
    }
    
    @Transactional
    public MessageResponse requestReset(String email) {
        userRepository.findByEmail(AuthService.normalizeEmail(email)).ifPresentOrElse(
            user -> {
                user.requestPasswordReset();
                userRepository.save(user);
                log.info("Password reset requested for user {}", user.getUserId());
            },
            () -> log.debug("Password reset requested for unknown email")
        );
        return new MessageResponse("Check your email for reset password.");
    }
    
    @Transactional(readOnly = true)
    public String renderResetPage(String token) {
        User user = resolveResetUser(token);
        return templates.render(RESET_PAGE_TEMPLATE, Map.of(
            "username", user.getUsername(),
            "token", token
        ));
    }
    
    @Transactional
    public MessageResponse resetPassword(String token, ResetPasswordForm form) {
        if (!form.newPassword().equals(form.confirmPassword())) {
            throw new UnprocessableEntityException("Unprocessable Entity");
        }
        
        User user = resolveResetUser(token);
        user.changePassword(passwordEncoder.encode(form.newPassword()));
        userRepository.save(user);
        log.info("Password reset for user {}", user.getUserId());
        
        return new MessageResponse("Password reset successfully");
    }
    
    private User resolveResetUser(String token) {
        Claims claims;
        try {
            claims = tokenProvider.validateToken(token, TokenScope.PASSWORD_RESET);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token for password reset", e);
        }
        
        // Consumed or superseded resets no longer match the stored id
        return userRepository.findByEmail(claims.getSubject())
                .filter(user -> user.hasOutstandingPasswordReset(claims.getId()))
                .orElseThrow(() -> new InvalidTokenException("Invalid token for password reset"));
    }
}
