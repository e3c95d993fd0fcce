package com.example.annotation.authz.policy;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;
import org.springframework.stereotype.Component;

/**
 * Policy: navigators manage their own evaluation sessions.
 *
 * Rule: ALLOW * on EVALUATION_SESSION WHERE resource.navigatorId = subject.userId
 */
@Component
public class SessionOwnerPolicy implements Policy {

    @Override
    public String getPolicyId() {
        return "SESSION_OWNER";
    }

    @Override
    public String getDescription() {
        return "Navigators can manage sessions they own";
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean appliesTo(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return resource.isSession();
    }

    @Override
    public PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        if (!appliesTo(subject, resource, action)) {
            return PolicyDecision.notApplicable(getPolicyId());
        }

        if (resource.isOwnedBy(subject.userId())) {
            return PolicyDecision.allow(getPolicyId(),
                    String.format("User %s owns session %s", subject.userId(), resource.id()));
        }
        return PolicyDecision.deny(getPolicyId(),
                String.format("User %s does not own session %s", subject.userId(), resource.id()));
    }
}
