package com.example.annotation.authz.policy;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;
import org.springframework.stereotype.Component;

/**
 * Policy: admins may perform any action on any resource.
 *
 * Rule: ALLOW * on * WHERE subject.role = admin
 */
@Component
public class AdminOverridePolicy implements Policy {

    @Override
    public String getPolicyId() {
        return "ADMIN_OVERRIDE";
    }

    @Override
    public String getDescription() {
        return "Admins have unconditional access to every resource and action";
    }

    @Override
    public int getPriority() {
        return 1000;
    }

    @Override
    public boolean appliesTo(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return subject.isAdmin();
    }

    @Override
    public PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        if (!appliesTo(subject, resource, action)) {
            return PolicyDecision.notApplicable(getPolicyId());
        }
        return PolicyDecision.allow(getPolicyId(),
                String.format("Admin %s has full access to %s", subject.userId(), resource.type()));
    }
}
