package com.starscape.contacts.features.auth.app;

import com.starscape.contacts.common.exception.InvalidTokenException;
import com.starscape.contacts.common.exception.VerificationException;
import com.starscape.contacts.common.security.JwtTokenProvider;
import com.starscape.contacts.common.security.TokenScope;
import com.starscape.contacts.features.auth.api.dto.MessageResponse;
import com.starscape.contacts.features.auth.domain.User;
import com.starscape.contacts.features.auth.domain.UserRepository;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Handler for confirming account emails and re-sending confirmation links.
 */
@Service
public class EmailVerificationHandler {
    
    private static final Logger log = LoggerFactory.getLogger(EmailVerificationHandler.class);
    
    static final String ALREADY_CONFIRMED = "Your email is already confirmed";
    
    private final UserRepository userRepository;
    private final JwtTokenProvider tokenProvider;
    
    public EmailVerificationHandler(
            UserRepository userRepository,
            JwtTokenProvider tokenProvider) {
        this.userRepository = userRepository;
        this.tokenProvider = tokenProvider;
    }
    
    @Transactional
    public MessageResponse confirm(String token) {
        String email;
        try {
            email = tokenProvider.validateToken(token, TokenScope.EMAIL_VERIFICATION).getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token for email verification", e);
        }
        
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new VerificationException("Verification error"));
        
        if (user.isConfirmed()) {
            return new MessageResponse(ALREADY_CONFIRMED);
        }
        
        user.confirmEmail();
        userRepository.save(user);
        log.info("Email confirmed for user {}", user.getUserId());
        
        return new MessageResponse("Email confirmed");
    }
    
    /**
     * Queue a new confirmation mail. Unknown addresses get the same answer as known ones.
     */
    @Transactional
    public MessageResponse requestVerification(String email) {
        Optional<User> found = userRepository.findByEmail(AuthService.normalizeEmail(email));
        
        if (found.isPresent() && found.get().isConfirmed()) {
            return new MessageResponse(ALREADY_CONFIRMED);
        }
        
        found.ifPresent(user -> {
            user.requestEmailVerification();
            userRepository.save(user);
        });
        
        return new MessageResponse("Check your email for confirmation.");
    }
}
