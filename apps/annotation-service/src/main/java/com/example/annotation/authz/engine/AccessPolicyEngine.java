package com.example.annotation.authz.engine;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;
import com.example.annotation.authz.policy.Policy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Access Policy Engine - evaluates policies to make access control decisions.
 *
 * <p>Policy combining algorithm: First Applicable (deny-biased)
 * - Policies are evaluated in priority order; the admin override sits on top
 * - First ALLOW or DENY decision wins
 * - If no policy matches, default is DENY
 *
 * <p>The engine is pure: it holds no per-caller state, so a role change in the
 * profile directory is visible on the very next evaluation.
 */
@Slf4j
@Component
public class AccessPolicyEngine {

    public static final String DEFAULT_DENY = "DEFAULT_DENY";

    private final List<Policy> policies;

    public AccessPolicyEngine(List<Policy> policies) {
        this.policies = policies.stream()
                .sorted(Comparator.comparingInt(Policy::getPriority).reversed())
                .toList();

        log.info("Access Policy Engine initialized with {} policies", this.policies.size());
        this.policies.forEach(p -> log.debug("  - {} (priority={}): {}",
                p.getPolicyId(), p.getPriority(), p.getDescription()));
    }

    /**
     * Evaluate all applicable policies and return the access decision.
     *
     * @param subject  The caller attributes
     * @param resource The resource being accessed
     * @param action   The action being performed
     * @return PolicyDecision with ALLOW or DENY
     */
    public PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        log.debug("Evaluating access: subject={}({}), resource={}/{}, action={}",
                subject.userId(), subject.roleName(), resource.type(), resource.id(), action);

        for (Policy policy : policies) {
            if (!policy.appliesTo(subject, resource, action)) {
                continue;
            }

            PolicyDecision decision = policy.evaluate(subject, resource, action);

            if (decision.isAllowed() || decision.isDenied()) {
                log.debug("Decision {} by policy {}: {}", decision.decision(), policy.getPolicyId(), decision.reason());
                return decision;
            }

            // NOT_APPLICABLE - continue to next policy
        }

        return PolicyDecision.deny(DEFAULT_DENY, "No policy granted access for this request");
    }

    public boolean isAllowed(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return evaluate(subject, resource, action).isAllowed();
    }

    public List<Policy> getPolicies() {
        return policies;
    }
}
