package com.starscape.contacts.common.security;

import com.starscape.contacts.features.users.app.CurrentUserLookup;
import com.starscape.contacts.features.users.app.UserSnapshot;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates requests carrying an access token in the {@code Authorization: Bearer} header.
 *
 * Requests with a missing, invalid or expired token, or whose user no longer exists, continue
 * unauthenticated and are rejected by the entry point on protected routes. The auth routes
 * read their own bearer tokens (refresh) and are skipped.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {
    
    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    
    private static final String BEARER_PREFIX = "Bearer ";
    
    private final JwtTokenProvider tokenProvider;
    private final CurrentUserLookup currentUserLookup;
    
    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider, CurrentUserLookup currentUserLookup) {
        this.tokenProvider = tokenProvider;
        this.currentUserLookup = currentUserLookup;
    }
    
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getServletPath().startsWith("/api/auth/");
    }
    
    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        
        String token = extractBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        
        if (token != null && SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                Claims claims = tokenProvider.validateToken(token, TokenScope.ACCESS);
                String userId = claims.getSubject();
                Optional<UserSnapshot> user = currentUserLookup.findById(userId);
                
                if (user.isPresent()) {
                    UserPrincipal principal = new UserPrincipal(user.get().id(), user.get().email());
                    UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities());
                    authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    SecurityContextHolder.getContext().setAuthentication(authentication);
                } else {
                    log.debug("Access token refers to unknown user: {}", userId);
                }
            } catch (JwtException | IllegalArgumentException e) {
                log.debug("Rejected access token: {}", e.getMessage());
            }
        }
        
        filterChain.doFilter(request, response);
    }
    
    public static String extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
