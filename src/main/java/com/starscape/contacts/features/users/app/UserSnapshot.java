package com.starscape.contacts.features.users.app;

import com.starscape.contacts.features.auth.domain.User;

import java.time.Instant;

/**
 * Read-only view of a user, as cached for authenticated requests.
 */
public record UserSnapshot(
    String id,
    String username,
    String email,
    String avatar,
    boolean confirmed,
    Instant createdAt
) {
    public static UserSnapshot of(User user) {
        return new UserSnapshot(
            user.getUserId(),
            user.getUsername(),
            user.getEmail(),
            user.getAvatar(),
            user.isConfirmed(),
            user.getCreatedAt()
        );
    }
}
