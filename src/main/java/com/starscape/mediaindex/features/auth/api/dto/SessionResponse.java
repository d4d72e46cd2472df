package com.starscape.mediaindex.features.auth.api.dto;

import com.starscape.mediaindex.features.auth.domain.User;

import java.time.Instant;

public record SessionResponse(
    String userUid,
    String userName,
    String fullName,
    String role,
    int loginAttempts,
    Instant loginAt
) {
    public static SessionResponse from(User user) {
        return new SessionResponse(user.getUserUid(), user.getUserName(), user.getFullName(),
            user.getRole().name(), user.getLoginAttempts(), user.getLoginAt());
    }
}
