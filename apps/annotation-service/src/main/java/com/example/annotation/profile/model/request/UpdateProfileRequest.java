package com.example.annotation.profile.model.request;

import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateProfileRequest(
        String role,
        @Size(max = 200) String fullName,
        String pin
) {}
