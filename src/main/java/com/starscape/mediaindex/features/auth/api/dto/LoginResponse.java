package com.starscape.mediaindex.features.auth.api.dto;

public record LoginResponse(
    String userUid,
    String userName,
    String role,
    String token,
    String tokenType,
    long expiresIn
) {
    public static LoginResponse of(String userUid, String userName, String role, String token, long expiresInMs) {
        return new LoginResponse(userUid, userName, role, token, "Bearer", expiresInMs);
    }
}
