package com.example.annotation.security.context;

/**
 * Identity of the caller as supplied by the upstream identity provider.
 * Carries no role: the role is looked up in the profile directory on every call.
 */
public record CallerContext(
        String callerId,
        String correlationId
) {
    public static CallerContext of(String callerId) {
        return new CallerContext(callerId, null);
    }
}
