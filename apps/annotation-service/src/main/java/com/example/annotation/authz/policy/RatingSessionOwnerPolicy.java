package com.example.annotation.authz.policy;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.SubjectAttributes;
import org.springframework.stereotype.Component;

/**
 * Policy: ratings of all three formats belong to whoever owns the parent session.
 * Ownership is not stored on the rating; the owner is resolved through the session.
 *
 * Rule: ALLOW * on FORMAT{1,2,3}_RATING WHERE session(resource.parentId).navigatorId = subject.userId
 */
@Component
public class RatingSessionOwnerPolicy implements Policy {

    @Override
    public String getPolicyId() {
        return "RATING_SESSION_OWNER";
    }

    @Override
    public String getDescription() {
        return "Navigators can manage ratings on sessions they own";
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean appliesTo(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        return resource.isRating();
    }

    @Override
    public PolicyDecision evaluate(SubjectAttributes subject, ResourceAttributes resource, Action action) {
        if (!appliesTo(subject, resource, action)) {
            return PolicyDecision.notApplicable(getPolicyId());
        }

        if (resource.isOwnedBy(subject.userId())) {
            return PolicyDecision.allow(getPolicyId(),
                    String.format("User %s owns session %s of %s", subject.userId(), resource.parentId(), resource.type()));
        }
        return PolicyDecision.deny(getPolicyId(),
                String.format("User %s does not own session %s", subject.userId(), resource.parentId()));
    }
}
