package com.starscape.mediaindex.features.auth.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
    @NotBlank(message = "User name is required")
    @Size(max = 64, message = "User name must be at most 64 characters")
    String userName,
    
    @NotBlank(message = "Password is required")
    @Size(min = 4, message = "Password must have at least 4 characters")
    String password,
    
    String fullName,
    
    @Email(message = "Email must be valid")
    String email
) {}
