package com.example.annotation.authz.model;

import com.example.annotation.profile.model.Role;

/**
 * Subject Attributes - the caller making the request.
 *
 * <p>The role comes from the profile directory at evaluation time; a caller
 * without a profile has a {@code null} role.
 */
public record SubjectAttributes(
        String userId,
        Role role
) {
    public static SubjectAttributes of(String userId, Role role) {
        return new SubjectAttributes(userId, role);
    }

    public static SubjectAttributes withoutProfile(String userId) {
        return new SubjectAttributes(userId, null);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean isNavigator() {
        return role == Role.NAVIGATOR;
    }

    public boolean hasProfile() {
        return role != null;
    }

    public String roleName() {
        return role != null ? role.value() : "none";
    }
}
