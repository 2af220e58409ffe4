package com.starscape.contacts.features.mail.app;

import com.starscape.contacts.common.config.AsyncConfig;
import com.starscape.contacts.common.security.JwtTokenProvider;
import com.starscape.contacts.common.web.HtmlTemplates;
import com.starscape.contacts.features.auth.domain.events.EmailVerificationRequested;
import com.starscape.contacts.features.auth.domain.events.PasswordResetRequested;
import com.starscape.contacts.features.auth.domain.events.UserRegistered;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Map;

/**
 * Mails account links once the transaction that requested them has committed.
 * Runs on the mail executor; delivery failures are logged and never reach the caller.
 */
@Component
public class AccountMailListener {

    private static final Logger log = LoggerFactory.getLogger(AccountMailListener.class);

    static final String VERIFY_TEMPLATE = "email_verify.html";
    static final String RESET_TEMPLATE = "email_reset.html";

    private final MailSender mailSender;
    private final HtmlTemplates templates;
    private final JwtTokenProvider tokenProvider;
    private final String publicBaseUrl;

    public AccountMailListener(
            MailSender mailSender,
            HtmlTemplates templates,
            JwtTokenProvider tokenProvider,
            @Value("${app.public-base-url}") String publicBaseUrl) {
        this.mailSender = mailSender;
        this.templates = templates;
        this.tokenProvider = tokenProvider;
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
                : publicBaseUrl;
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onUserRegistered(UserRegistered event) {
        sendVerification(event.userId(), event.email(), event.username());
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEmailVerificationRequested(EmailVerificationRequested event) {
        sendVerification(event.userId(), event.email(), event.username());
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPasswordResetRequested(PasswordResetRequested event) {
        String token = tokenProvider.generatePasswordResetToken(event.email(), event.resetTokenId());
        String html = templates.render(RESET_TEMPLATE, Map.of(
            "username", event.username(),
            "link", publicBaseUrl + "/api/auth/reset_password_template/" + token
        ));
        deliver(event.userId(), event.email(), "Reset password", html);
    }

    private void sendVerification(String userId, String email, String username) {
        String token = tokenProvider.generateEmailVerificationToken(email);
        String html = templates.render(VERIFY_TEMPLATE, Map.of(
            "username", username,
            "link", publicBaseUrl + "/api/auth/confirmed_email/" + token
        ));
        deliver(userId, email, "Confirm your email", html);
    }

    private void deliver(String userId, String email, String subject, String html) {
        try {
            mailSender.send(email, subject, html);
            log.info("Sent '{}' mail to user {}", subject, userId);
        } catch (RuntimeException e) {
            log.error("Failed to send '{}' mail to user {}", subject, userId, e);
        }
    }
}
