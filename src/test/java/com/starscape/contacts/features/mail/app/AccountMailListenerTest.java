package com.starscape.contacts.features.mail.app;

import com.starscape.contacts.common.security.JwtTokenProvider;
import com.starscape.contacts.common.security.TokenScope;
import com.starscape.contacts.common.web.HtmlTemplates;
import com.starscape.contacts.features.auth.domain.events.PasswordResetRequested;
import com.starscape.contacts.features.auth.domain.events.UserRegistered;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AccountMailListenerTest {
    
    private static final Pattern LINK = Pattern.compile("href=\"([^\"]+)\"");
    
    private final MailSender mailSender = mock(MailSender.class);
    private final JwtTokenProvider tokenProvider = new JwtTokenProvider(
        "unit-test-secret-that-is-at-least-32-bytes-long", "contacts-api",
        Duration.ofMinutes(15), Duration.ofDays(7), Duration.ofDays(7), Duration.ofHours(1));
    private final AccountMailListener listener = new AccountMailListener(
        mailSender, new HtmlTemplates(), tokenProvider, "https://contacts.example.com/");
    
    @Test
    void registrationMailLinksToEmailConfirmation() {
        listener.onUserRegistered(new UserRegistered("user_1", "a@example.com", "alice", Instant.now()));
        
        String link = sentLink("a@example.com", "Confirm your email");
        String prefix = "https://contacts.example.com/api/auth/confirmed_email/";
        assertTrue(link.startsWith(prefix), link);
        String token = link.substring(prefix.length());
        assertEquals("a@example.com", tokenProvider.validateToken(token, TokenScope.EMAIL_VERIFICATION).getSubject());
    }
    
    @Test
    void resetMailCarriesResetId() {
        listener.onPasswordResetRequested(
            new PasswordResetRequested("user_1", "a@example.com", "alice", "rst_9", Instant.now()));
        
        String link = sentLink("a@example.com", "Reset password");
        String token = link.substring(link.lastIndexOf('/') + 1);
        assertTrue(link.contains("/api/auth/reset_password_template/"));
        assertEquals("rst_9", tokenProvider.validateToken(token, TokenScope.PASSWORD_RESET).getId());
    }
    
    @Test
    void deliveryFailureDoesNotPropagate() {
        doThrow(new MailDeliveryException("rejected", new RuntimeException()))
            .when(mailSender).send(anyString(), anyString(), anyString());
        
        assertDoesNotThrow(() ->
            listener.onUserRegistered(new UserRegistered("user_1", "a@example.com", "alice", Instant.now())));
    }
    
    private String sentLink(String to, String subject) {
        ArgumentCaptor<String> html = ArgumentCaptor.forClass(String.class);
        verify(mailSender).send(eq(to), eq(subject), html.capture());
        Matcher matcher = LINK.matcher(html.getValue());
        assertTrue(matcher.find());
        return matcher.group(1);
    }
}
