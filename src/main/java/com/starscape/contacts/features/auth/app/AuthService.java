package com.starscape.contacts.features.auth.app;

import com.starscape.contacts.common.exception.ConflictException;
import com.starscape.contacts.common.security.JwtTokenProvider;
import com.starscape.contacts.common.security.TokenScope;
import com.starscape.contacts.features.auth.api.dto.LoginForm;
import com.starscape.contacts.features.auth.api.dto.SignupRequest;
import com.starscape.contacts.features.auth.api.dto.SignupResponse;
import com.starscape.contacts.features.auth.api.dto.TokenResponse;
import com.starscape.contacts.features.auth.domain.User;
import com.starscape.contacts.features.auth.domain.UserRepository;
import com.starscape.contacts.features.users.api.dto.UserResponse;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.UUID;

@Service
public class AuthService {
    
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    
    static final String INVALID_CREDENTIALS = "Could not validate credentials";
    
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;
    
    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenProvider tokenProvider) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenProvider = tokenProvider;
    }
    
    @Transactional
    public SignupResponse signup(SignupRequest request) {
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("Account already exists");
        }
        
        String userId = "user_" + UUID.randomUUID().toString().replace("-", "");
        String passwordHash = passwordEncoder.encode(request.password());
        
        User user = new User(userId, request.username().trim(), email, passwordHash, GravatarUrls.forEmail(email));
        userRepository.save(user);
        log.info("Registered user {}", userId);
        
        return new SignupResponse(
            UserResponse.of(user),
            "User successfully created. Check your email for confirmation."
        );
    }
    
    @Transactional
    public TokenResponse login(LoginForm form) {
        User user = userRepository.findByEmail(normalizeEmail(form.username()))
                .orElseThrow(() -> new BadCredentialsException("Invalid email"));
        
        if (!user.isConfirmed()) {
            throw new DisabledException("Email not confirmed");
        }
        
        if (!passwordEncoder.matches(form.password(), user.getPasswordHash())) {
            throw new BadCredentialsException("Invalid password");
        }
        
        return issueTokens(user);
    }
    
    /**
     * Exchange the stored refresh token for a new pair. Presenting a validly signed refresh
     * token that is not the stored one revokes the stored token as well.
     */
    @Transactional(noRollbackFor = BadCredentialsException.class)
    public TokenResponse refresh(String refreshToken) {
        if (refreshToken == null) {
            throw new BadCredentialsException(INVALID_CREDENTIALS);
        }
        
        String userId;
        try {
            Claims claims = tokenProvider.validateToken(refreshToken, TokenScope.REFRESH);
            userId = claims.getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            throw new BadCredentialsException(INVALID_CREDENTIALS, e);
        }
        
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new BadCredentialsException(INVALID_CREDENTIALS));
        
        if (!user.holdsRefreshToken(refreshToken)) {
            log.warn("Refresh token reuse detected for user {}, revoking", userId);
            user.updateRefreshToken(null);
            userRepository.save(user);
            throw new BadCredentialsException("Invalid refresh token");
        }
        
        return issueTokens(user);
    }
    
    private TokenResponse issueTokens(User user) {
        String accessToken = tokenProvider.generateAccessToken(user.getUserId(), user.getEmail());
        String refreshToken = tokenProvider.generateRefreshToken(user.getUserId(), user.getEmail());
        user.updateRefreshToken(refreshToken);
        userRepository.save(user);
        
        return TokenResponse.bearer(accessToken, refreshToken, tokenProvider.getAccessTokenTtl().toSeconds());
    }
    
    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
