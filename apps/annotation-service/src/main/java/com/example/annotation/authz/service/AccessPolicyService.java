package com.example.annotation.authz.service;

import com.example.annotation.authz.audit.AuthzAuditService;
import com.example.annotation.authz.engine.AccessPolicyEngine;
import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;
import com.example.annotation.common.exception.ForbiddenException;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.profile.service.RoleDirectory;
import com.example.annotation.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Gate in front of every data operation.
 *
 * <p>Builds the subject from the role directory on each call, asks the engine,
 * audits the decision and fails with {@link ForbiddenException} on deny.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessPolicyService {

    private final RoleDirectory roleDirectory;
    private final AccessPolicyEngine policyEngine;
    private final AuthzAuditService auditService;
    private final EvaluationMetrics metrics;

    /**
     * Resolves the caller's current role. Never cached.
     */
    public Mono<SubjectAttributes> resolveSubject(@NonNull CallerContext caller) {
        return roleDirectory.findRole(caller.callerId())
                .map(role -> SubjectAttributes.of(caller.callerId(), role))
                .defaultIfEmpty(SubjectAttributes.withoutProfile(caller.callerId()));
    }

    /**
     * Authorizes the action and emits the resolved subject on allow.
     *
     * @return the subject, or a {@link ForbiddenException} error
     */
    public Mono<SubjectAttributes> authorize(
            @NonNull CallerContext caller,
            @NonNull ResourceAttributes resource,
            @NonNull Action action) {

        return resolveSubject(caller)
                .flatMap(subject -> check(subject, resource, action, caller.correlationId()));
    }

    /**
     * Authorizes against an already resolved subject, for operations that check
     * several resources in one request.
     */
    public Mono<SubjectAttributes> check(
            @NonNull SubjectAttributes subject,
            @NonNull ResourceAttributes resource,
            @NonNull Action action,
            String correlationId) {

        PolicyDecision decision = policyEngine.evaluate(subject, resource, action);
        auditService.logDecision(subject, resource, action, decision, correlationId);
        metrics.recordPolicyDecision(decision.isAllowed(), decision.policyId(), action.name());

        if (decision.isAllowed()) {
            return Mono.just(subject);
        }

        log.warn("Access denied: user={}, role={}, resource={}/{}, action={}, policy={}",
                subject.userId(), subject.roleName(), resource.type(), resource.id(), action, decision.policyId());
        return Mono.error(new ForbiddenException(
                String.format("Access denied to %s %s", resource.type(), resource.id()),
                subject.userId(),
                decision.policyId()));
    }
}
