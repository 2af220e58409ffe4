package com.starscape.contacts.common.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

@Component
public class JwtTokenProvider {
    
    public static final String SCOPE_CLAIM = "scope";
    public static final String EMAIL_CLAIM = "email";
    
    private final SecretKey secretKey;
    private final String issuer;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Duration emailTokenTtl;
    private final Duration resetTokenTtl;
    
    public JwtTokenProvider(
            @Value("${app.security.jwt.secret}") String secret,
            @Value("${app.security.jwt.issuer}") String issuer,
            @Value("${app.security.jwt.access-token-ttl}") Duration accessTokenTtl,
            @Value("${app.security.jwt.refresh-token-ttl}") Duration refreshTokenTtl,
            @Value("${app.security.jwt.email-token-ttl}") Duration emailTokenTtl,
            @Value("${app.security.jwt.reset-token-ttl}") Duration resetTokenTtl) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.emailTokenTtl = emailTokenTtl;
        this.resetTokenTtl = resetTokenTtl;
    }
    
    public String generateAccessToken(String userId, String email) {
        return builder(userId, TokenScope.ACCESS, accessTokenTtl)
                .claim(EMAIL_CLAIM, email)
                .compact();
    }
    
    public String generateRefreshToken(String userId, String email) {
        // unique id so that a rotated refresh token never equals its predecessor
        return builder(userId, TokenScope.REFRESH, refreshTokenTtl)
                .id(UUID.randomUUID().toString())
                .claim(EMAIL_CLAIM, email)
                .compact();
    }
    
    public String generateEmailVerificationToken(String email) {
        return builder(email, TokenScope.EMAIL_VERIFICATION, emailTokenTtl).compact();
    }
    
    /**
     * @param resetTokenId id of the reset request stored on the user; becomes the token's {@code jti}
     */
    public String generatePasswordResetToken(String email, String resetTokenId) {
        return builder(email, TokenScope.PASSWORD_RESET, resetTokenTtl)
                .id(resetTokenId)
                .compact();
    }
    
    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }
    
    /**
     * Verify signature, issuer, expiry and kind of the token.
     *
     * @throws JwtException if any check fails
     * @throws IllegalArgumentException if the token is null or blank
     */
    public Claims validateToken(String token, TokenScope expectedScope) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .requireIssuer(issuer)
                .require(SCOPE_CLAIM, expectedScope.claimValue())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
    
    public boolean isTokenValid(String token, TokenScope expectedScope) {
        try {
            validateToken(token, expectedScope);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }
    
    private JwtBuilder builder(String subject, TokenScope scope, Duration ttl) {
        Instant now = Instant.now();
        Instant expiration = now.plus(ttl);
        
        return Jwts.builder()
                .subject(subject)
                .claim(SCOPE_CLAIM, scope.claimValue())
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(secretKey, Jwts.SIG.HS256);
    }
}
