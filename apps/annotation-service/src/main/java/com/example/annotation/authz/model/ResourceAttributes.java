package com.example.annotation.authz.model;

/**
 * Resource Attributes - the record being accessed.
 *
 * <p>{@code ownerId} is the navigator that owns the record: the profile id itself,
 * the session's navigator, or for ratings the navigator of the owning session.
 * It is {@code null} for cases (not owned) and for records that do not exist,
 * which makes ownership rules deny and keeps existence hidden.
 */
public record ResourceAttributes(
        ResourceType type,
        String id,
        String ownerId,
        String parentId
) {
    /**
     * Resource types in the system.
     */
    public enum ResourceType {
        PROFILE,
        SYNTHETIC_CASE,
        EVALUATION_SESSION,
        FORMAT1_RATING,     // Timeline-event ratings
        FORMAT2_RATING,     // Tactic-triple ratings
        FORMAT3_RATING;     // Boundary/category ratings

        public boolean isRating() {
            return this == FORMAT1_RATING || this == FORMAT2_RATING || this == FORMAT3_RATING;
        }
    }

    public static ResourceAttributes profile(String profileId) {
        return new ResourceAttributes(ResourceType.PROFILE, profileId, profileId, null);
    }

    /**
     * Collection-level attributes for listing profiles; no owner, so only admins pass.
     */
    public static ResourceAttributes profiles() {
        return new ResourceAttributes(ResourceType.PROFILE, "*", null, null);
    }

    public static ResourceAttributes syntheticCase(String caseId) {
        return new ResourceAttributes(ResourceType.SYNTHETIC_CASE, caseId, null, null);
    }

    /**
     * @param sessionId   the session ID ("new" for inserts)
     * @param navigatorId the owning navigator, or null when the session does not exist
     */
    public static ResourceAttributes session(String sessionId, String navigatorId) {
        return new ResourceAttributes(ResourceType.EVALUATION_SESSION, sessionId, navigatorId, null);
    }

    /**
     * Ratings carry the owner of their session, resolved by the caller via session lookup.
     *
     * @param type        one of the three rating types
     * @param ratingId    the rating ID ("*" for list operations)
     * @param sessionId   the owning session
     * @param navigatorId the owning session's navigator, or null when the session does not exist
     */
    public static ResourceAttributes rating(ResourceType type, String ratingId, String sessionId, String navigatorId) {
        if (!type.isRating()) {
            throw new IllegalArgumentException("Not a rating type: " + type);
        }
        return new ResourceAttributes(type, ratingId, navigatorId, sessionId);
    }

    public boolean isProfile() {
        return type == ResourceType.PROFILE;
    }

    public boolean isSyntheticCase() {
        return type == ResourceType.SYNTHETIC_CASE;
    }

    public boolean isSession() {
        return type == ResourceType.EVALUATION_SESSION;
    }

    public boolean isRating() {
        return type.isRating();
    }

    public boolean isOwnedBy(String subjectId) {
        return subjectId != null && subjectId.equals(ownerId);
    }
}
