package com.starscape.mediaindex.features.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
    @NotBlank(message = "User name is required")
    String userName,
    
    @NotBlank(message = "Password is required")
    String password
) {}
