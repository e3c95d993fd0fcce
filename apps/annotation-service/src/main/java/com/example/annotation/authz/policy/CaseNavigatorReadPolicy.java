package com.example.annotation.authz.policy;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;
import org.springframework.stereotype.Component;

/**
 * Policy: navigators can read the case catalog. Cases are authored content,
 * so writes stay with admins.
 *
 * Rule: ALLOW SELECT on SYNTHETIC_CASE WHERE subject.role = navigator
 */
@Component
public class CaseNavigatorReadPolicy implements Policy {

    @Override
    public String getPolicyId() {
        return "CASE_NAVIGATOR_READ";
    }

    @Override
    public String getDescription() {
        return "Navigators can read synthetic cases";
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean appliesTo(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return resource.isSyntheticCase();
    }

    @Override
    public PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        if (!appliesTo(subject, resource, action)) {
            return PolicyDecision.notApplicable(getPolicyId());
        }

        if (action != Action.SELECT) {
            return PolicyDecision.deny(getPolicyId(),
                    String.format("Action %s on cases is reserved for admins", action));
        }
        if (!subject.isNavigator()) {
            return PolicyDecision.deny(getPolicyId(),
                    String.format("User %s has role '%s', navigator required", subject.userId(), subject.roleName()));
        }
        return PolicyDecision.allow(getPolicyId(),
                String.format("Navigator %s can read case %s", subject.userId(), resource.id()));
    }
}
