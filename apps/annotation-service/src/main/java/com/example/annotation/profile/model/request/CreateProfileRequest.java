package com.example.annotation.profile.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param id       target identity; defaults to the caller
 * @param role     {@code admin} or {@code navigator}
 * @param fullName display name
 * @param pin      optional four-digit code
 */
public record CreateProfileRequest(
        @Size(max = 128) String id,
        @NotBlank String role,
        @NotBlank @Size(max = 200) String fullName,
        String pin
) {}
