package com.starscape.contacts.features.auth.api.dto;

import com.starscape.contacts.features.users.api.dto.UserResponse;

public record SignupResponse(
    UserResponse user,
    String detail
) {}
