package com.starscape.contacts.integration;

import com.starscape.contacts.common.security.JwtTokenProvider;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Value;

import java.time.Duration;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Integration tests for the forgot-password flow.
 */
public class PasswordResetIntegrationTest extends BaseIntegrationTest {
    
    private static final String RESET_SUBJECT = "Reset password";
    private static final String NEW_PASSWORD = "brandnew42";
    
    @Value("${app.security.jwt.secret}")
    private String jwtSecret;
    
    @Value("${app.security.jwt.issuer}")
    private String jwtIssuer;
    
    @Test
    void shouldResetPasswordOnceWithMailedToken() {
        TestAccount account = registerConfirmedAccount("reset");
        requestReset(account.email());
        String token = awaitMailedToken(account.email(), RESET_SUBJECT);
        
        given()
                .get("/api/auth/reset_password_template/" + token)
                .then()
                .statusCode(200)
                .contentType(containsString("text/html"))
                .body(containsString("action=\"/api/auth/reset_password/" + token + "\""))
                .body(containsString("name=\"new_password\""));
        
        resetPassword(token, NEW_PASSWORD, "different1")
                .then()
                .statusCode(422)
                .body("message", equalTo("Unprocessable Entity"));
        
        resetPassword(token, NEW_PASSWORD, NEW_PASSWORD)
                .then()
                .statusCode(200)
                .body("message", equalTo("Password reset successfully"));
        
        login(account.email(), PASSWORD)
                .then()
                .statusCode(401)
                .body("message", equalTo("Invalid password"));
        
        login(account.email(), NEW_PASSWORD)
                .then()
                .statusCode(200);
        
        // Single use
        resetPassword(token, "another99", "another99")
                .then()
                .statusCode(422)
                .body("message", equalTo("Invalid token for password reset"));
        
        given()
                .get("/api/auth/reset_password_template/" + token)
                .then()
                .statusCode(422);
    }
    
    @Test
    void shouldRevokeRefreshTokenOnReset() {
        TestAccount account = registerConfirmedAccount("revoke");
        requestReset(account.email());
        String token = awaitMailedToken(account.email(), RESET_SUBJECT);
        
        resetPassword(token, NEW_PASSWORD, NEW_PASSWORD)
                .then()
                .statusCode(200);
        
        given()
                .header("Authorization", "Bearer " + account.refreshToken())
                .get("/api/auth/refresh_token")
                .then()
                .statusCode(401)
                .body("message", equalTo("Invalid refresh token"));
    }
    
    @Test
    void shouldInvalidateEarlierResetTokenWhenANewOneIsRequested() {
        TestAccount account = registerConfirmedAccount("supersede");
        requestReset(account.email());
        String first = awaitMailedToken(account.email(), RESET_SUBJECT);
        requestReset(account.email());
        String second = awaitMailedToken(account.email(), RESET_SUBJECT, 2);
        
        resetPassword(first, NEW_PASSWORD, NEW_PASSWORD)
                .then()
                .statusCode(422);
        
        resetPassword(second, NEW_PASSWORD, NEW_PASSWORD)
                .then()
                .statusCode(200);
    }
    
    @Test
    void shouldRejectExpiredResetToken() {
        TestAccount account = registerConfirmedAccount("expired");
        requestReset(account.email());
        awaitMailedToken(account.email(), RESET_SUBJECT);
        String resetId = userRepository.findById(account.userId()).orElseThrow().getPasswordResetTokenId();
        
        Duration hour = Duration.ofHours(1);
        String expired = new JwtTokenProvider(jwtSecret, jwtIssuer, hour, hour, hour, Duration.ofMinutes(-1))
                .generatePasswordResetToken(account.email(), resetId);
        
        given()
                .get("/api/auth/reset_password_template/" + expired)
                .then()
                .statusCode(422)
                .body("code", equalTo("INVALID_TOKEN"));
        
        resetPassword(expired, NEW_PASSWORD, NEW_PASSWORD)
                .then()
                .statusCode(422)
                .body("message", equalTo("Invalid token for password reset"));
        
        login(account.email(), PASSWORD)
                .then()
                .statusCode(200);
    }
    
    @Test
    void shouldAnswerUnknownEmailWithoutSendingMail() {
        String email = uniqueEmail("ghost");
        
        requestReset(email);
        
        verify(mailSender, after(1000).never()).send(eq(email), anyString(), anyString());
    }
    
    @Test
    void shouldRejectForeignTokens() {
        TestAccount account = registerConfirmedAccount("foreign");
        
        resetPassword(account.accessToken(), NEW_PASSWORD, NEW_PASSWORD)
                .then()
                .statusCode(422)
                .body("code", equalTo("INVALID_TOKEN"));
    }
    
    private void requestReset(String email) {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("email", email))
                .post("/api/auth/forgot_password")
                .then()
                .statusCode(202)
                .body("message", equalTo("Check your email for reset password."));
    }
    
    private io.restassured.response.Response resetPassword(String token, String password, String confirmation) {
        return given()
                .formParam("new_password", password)
                .formParam("confirm_password", confirmation)
                .post("/api/auth/reset_password/" + token);
    }
}
