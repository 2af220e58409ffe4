package com.starscape.contacts.features.users.api.dto;

import com.starscape.contacts.features.auth.domain.User;
import com.starscape.contacts.features.users.app.UserSnapshot;

import java.time.Instant;

public record UserResponse(
    String id,
    String username,
    String email,
    String avatar,
    Instant createdAt
) {
    public static UserResponse of(User user) {
        return new UserResponse(user.getUserId(), user.getUsername(), user.getEmail(),
            user.getAvatar(), user.getCreatedAt());
    }

    public static UserResponse of(UserSnapshot user) {
        return new UserResponse(user.id(), user.username(), user.email(), user.avatar(), user.createdAt());
    }
}
