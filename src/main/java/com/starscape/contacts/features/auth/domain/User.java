package com.starscape.contacts.features.auth.domain;

import com.starscape.contacts.common.domain.AggregateRoot;
import com.starscape.contacts.features.auth.domain.events.AvatarChanged;
import com.starscape.contacts.features.auth.domain.events.EmailConfirmed;
import com.starscape.contacts.features.auth.domain.events.EmailVerificationRequested;
import com.starscape.contacts.features.auth.domain.events.PasswordChanged;
import com.starscape.contacts.features.auth.domain.events.PasswordResetRequested;
import com.starscape.contacts.features.auth.domain.events.UserRegistered;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "users")
public class User extends AggregateRoot<String> {
    
    @Id
    @Column(name = "user_id")
    private String userId;
    
    @Column(nullable = false, length = 25)
    private String username;
    
    @Column(nullable = false, unique = true, length = 150)
    private String email;
    
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;
    
    @Column(length = 1024)
    private String avatar;
    
    @Column(name = "refresh_token", length = 1024)
    private String refreshToken;
    
    @Column(nullable = false)
    private boolean confirmed;
    
    @Column(name = "password_reset_token_id")
    private String passwordResetTokenId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected User() {
        // JPA constructor
    }
    
    public User(String userId, String username, String email, String passwordHash, String avatar) {
        super(userId);
        this.userId = Objects.requireNonNull(userId);
        this.username = Objects.requireNonNull(username);
        this.email = Objects.requireNonNull(email);
        this.passwordHash = Objects.requireNonNull(passwordHash);
        this.avatar = avatar;
        this.confirmed = false;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
        
        registerEvent(new UserRegistered(userId, email, username, createdAt));
    }
    
    @Override
    public String getId() {
        return userId;
    }
    
    public String getUserId() {
        return getId();
    }
    
    public String getUsername() {
        return username;
    }
    
    public String getEmail() {
        return email;
    }
    
    public String getPasswordHash() {
        return passwordHash;
    }
    
    public String getAvatar() {
        return avatar;
    }
    
    public String getRefreshToken() {
        return refreshToken;
    }
    
    public boolean isConfirmed() {
        return confirmed;
    }
    
    public String getPasswordResetTokenId() {
        return passwordResetTokenId;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public Instant getUpdatedAt() {
        return updatedAt;
    }
    
    public void confirmEmail() {
        this.confirmed = true;
        this.updatedAt = Instant.now();
        registerEvent(new EmailConfirmed(userId, updatedAt));
    }
    
    /**
     * Remember the one refresh token currently allowed to mint new token pairs; {@code null} revokes it.
     */
    public void updateRefreshToken(String refreshToken) {
        this.refreshToken = refreshToken;
        this.updatedAt = Instant.now();
    }
    
    public boolean holdsRefreshToken(String token) {
        return refreshToken != null && refreshToken.equals(token);
    }
    
    public void requestEmailVerification() {
        registerEvent(new EmailVerificationRequested(userId, email, username, Instant.now()));
    }
    
    /**
     * Start a password reset. Any earlier outstanding reset is superseded.
     * @return id of the new reset request, embedded in the emailed token
     */
    public String requestPasswordReset() {
        this.passwordResetTokenId = "rst_" + UUID.randomUUID().toString().replace("-", "");
        this.updatedAt = Instant.now();
        registerEvent(new PasswordResetRequested(userId, email, username, passwordResetTokenId, Instant.now()));
        return passwordResetTokenId;
    }
    
    public boolean hasOutstandingPasswordReset(String resetTokenId) {
        return passwordResetTokenId != null && passwordResetTokenId.equals(resetTokenId);
    }
    
    /**
     * Replace the password, consuming the outstanding reset and revoking the refresh token.
     */
    public void changePassword(String newPasswordHash) {
        this.passwordHash = Objects.requireNonNull(newPasswordHash);
        this.passwordResetTokenId = null;
        this.refreshToken = null;
        this.updatedAt = Instant.now();
        registerEvent(new PasswordChanged(userId, updatedAt));
    }
    
    public void changeAvatar(String avatarUrl) {
        String previousAvatar = this.avatar;
        this.avatar = avatarUrl;
        this.updatedAt = Instant.now();
        registerEvent(new AvatarChanged(userId, previousAvatar, avatarUrl, updatedAt));
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
