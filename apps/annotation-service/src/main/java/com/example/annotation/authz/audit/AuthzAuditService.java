package com.example.annotation.authz.audit;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;
import com.example.annotation.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Publishes authorization decisions as structured JSON on the {@code AUTHZ_AUDIT} logger.
 */
@Service
@RequiredArgsConstructor
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final ObjectMapper objectMapper;

    public void logDecision(
            @NonNull SubjectAttributes subject,
            @NonNull ResourceAttributes resource,
            @NonNull Action action,
            @NonNull PolicyDecision decision,
            @Nullable String correlationId) {

        logEvent(AuthzAuditEvent.from(subject, resource, action, decision, correlationId));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            if (event.outcome() == AuthzAuditEvent.Outcome.ALLOW) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - user={}, role={}, resource={}/{}, action={}, policy={}, reason={}",
                event.outcome(),
                StringSanitizer.forLog(event.userId()),
                event.role(),
                event.resourceType(),
                StringSanitizer.forLog(event.resourceId()),
                event.action(),
                event.policyId(),
                StringSanitizer.forLog(event.reason(), 200));
    }
}
