package com.example.annotation.profile.model.response;

import com.example.annotation.profile.document.ProfileDoc;
import com.example.annotation.profile.model.Role;

import java.time.Instant;

public record ProfileResponse(
        String id,
        Role role,
        String fullName,
        boolean hasPin,
        Instant createdAt
) {
    public static ProfileResponse from(ProfileDoc doc) {
        return new ProfileResponse(
                doc.getId(),
                doc.getRole(),
                doc.getFullName(),
                doc.getPin() != null,
                doc.getCreatedAt());
    }
}
