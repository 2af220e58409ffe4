package com.starscape.contacts.common.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenProviderTest {
    
    private static final String SECRET = "unit-test-secret-that-is-at-least-32-bytes-long";
    
    private final JwtTokenProvider provider = provider(SECRET, Duration.ofMinutes(15));
    
    @Test
    void accessTokenCarriesUserIdAndEmail() {
        String token = provider.generateAccessToken("user_1", "a@example.com");
        
        Claims claims = provider.validateToken(token, TokenScope.ACCESS);
        
        assertEquals("user_1", claims.getSubject());
        assertEquals("a@example.com", claims.get(JwtTokenProvider.EMAIL_CLAIM, String.class));
        assertEquals("access_token", claims.get(JwtTokenProvider.SCOPE_CLAIM, String.class));
        assertEquals("contacts-api", claims.getIssuer());
    }
    
    @Test
    void tokenOfAnotherKindIsRejected() {
        String access = provider.generateAccessToken("user_1", "a@example.com");
        String emailToken = provider.generateEmailVerificationToken("a@example.com");
        
        assertThrows(IncorrectClaimException.class, () -> provider.validateToken(access, TokenScope.REFRESH));
        assertThrows(IncorrectClaimException.class, () -> provider.validateToken(emailToken, TokenScope.PASSWORD_RESET));
        assertFalse(provider.isTokenValid(access, TokenScope.EMAIL_VERIFICATION));
    }
    
    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenProvider foreign = provider("another-secret-that-is-also-at-least-32-bytes", Duration.ofMinutes(15));
        String token = foreign.generateAccessToken("user_1", "a@example.com");
        
        assertThrows(JwtException.class, () -> provider.validateToken(token, TokenScope.ACCESS));
    }
    
    @Test
    void tamperedPayloadIsRejected() {
        String token = provider.generateAccessToken("user_1", "a@example.com");
        String[] parts = token.split("\\.");
        String forgedPayload = provider.generateAccessToken("user_2", "b@example.com").split("\\.")[1];
        String forged = parts[0] + "." + forgedPayload + "." + parts[2];
        
        assertThrows(JwtException.class, () -> provider.validateToken(forged, TokenScope.ACCESS));
    }
    
    @Test
    void expiredTokenIsRejected() {
        JwtTokenProvider expired = provider(SECRET, Duration.ofMinutes(-1));
        String token = expired.generateAccessToken("user_1", "a@example.com");
        
        assertThrows(ExpiredJwtException.class, () -> provider.validateToken(token, TokenScope.ACCESS));
    }
    
    @Test
    void blankTokenIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> provider.validateToken(" ", TokenScope.ACCESS));
        assertFalse(provider.isTokenValid(null, TokenScope.ACCESS));
    }
    
    @Test
    void refreshTokensAreUniqueEvenWithinTheSameSecond() {
        String first = provider.generateRefreshToken("user_1", "a@example.com");
        String second = provider.generateRefreshToken("user_1", "a@example.com");
        
        assertNotEquals(first, second);
    }
    
    @Test
    void resetTokenCarriesResetId() {
        String token = provider.generatePasswordResetToken("a@example.com", "rst_42");
        
        Claims claims = provider.validateToken(token, TokenScope.PASSWORD_RESET);
        
        assertEquals("a@example.com", claims.getSubject());
        assertEquals("rst_42", claims.getId());
    }
    
    @Test
    void extractsBearerToken() {
        assertEquals("abc", JwtAuthenticationFilter.extractBearerToken("Bearer abc"));
        assertNull(JwtAuthenticationFilter.extractBearerToken("Basic abc"));
        assertNull(JwtAuthenticationFilter.extractBearerToken("Bearer   "));
        assertNull(JwtAuthenticationFilter.extractBearerToken(null));
    }
    
    private static JwtTokenProvider provider(String secret, Duration ttl) {
        return new JwtTokenProvider(secret, "contacts-api", ttl, ttl, ttl, ttl);
    }
}
