package com.example.annotation.authz.policy;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;
import org.springframework.stereotype.Component;

/**
 * Policy: a caller may create and read their own profile, nothing else.
 * Holds for callers without a profile, which is how first registration works.
 *
 * Rule: ALLOW INSERT/SELECT on PROFILE WHERE resource.id = subject.userId
 */
@Component
public class ProfileOwnerPolicy implements Policy {

    @Override
    public String getPolicyId() {
        return "PROFILE_OWNER";
    }

    @Override
    public String getDescription() {
        return "Callers can insert and read their own profile only";
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean appliesTo(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return resource.isProfile();
    }

    @Override
    public PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        if (!appliesTo(subject, resource, action)) {
            return PolicyDecision.notApplicable(getPolicyId());
        }

        if (action != Action.INSERT && action != Action.SELECT) {
            return PolicyDecision.deny(getPolicyId(),
                    String.format("Action %s on profiles is reserved for admins", action));
        }

        if (resource.isOwnedBy(subject.userId())) {
            return PolicyDecision.allow(getPolicyId(),
                    String.format("User %s owns profile %s", subject.userId(), resource.id()));
        }
        return PolicyDecision.deny(getPolicyId(),
                String.format("User %s does not own profile %s", subject.userId(), resource.id()));
    }
}
