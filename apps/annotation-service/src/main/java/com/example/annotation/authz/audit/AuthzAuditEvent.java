package com.example.annotation.authz.audit;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for authorization decisions.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        String policyId,
        String reason,

        // Subject
        String userId,
        String role,

        // Resource
        String resourceType,
        String resourceId,
        String parentId,

        // Action
        Action action
) {
    public enum Outcome {
        ALLOW, DENY
    }

    /**
     * Creates an audit event from authorization context.
     */
    public static AuthzAuditEvent from(
            SubjectAttributes subject,
            ResourceAttributes resource,
            Action action,
            PolicyDecision decision,
            String correlationId) {

        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                correlationId,
                decision.isAllowed() ? Outcome.ALLOW : Outcome.DENY,
                decision.policyId(),
                decision.reason(),
                subject.userId(),
                subject.roleName(),
                resource.type().name(),
                resource.id(),
                resource.parentId(),
                action
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "authz_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("correlation_id", correlationId != null ? correlationId : ""),
                Map.entry("outcome", outcome.name()),
                Map.entry("policy_id", policyId != null ? policyId : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("role", role != null ? role : ""),
                Map.entry("resource_type", resourceType != null ? resourceType : ""),
                Map.entry("resource_id", resourceId != null ? resourceId : ""),
                Map.entry("parent_id", parentId != null ? parentId : ""),
                Map.entry("action", action != null ? action.name() : "")
        );
    }
}
