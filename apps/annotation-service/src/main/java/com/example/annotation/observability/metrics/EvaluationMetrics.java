package com.example.annotation.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Business metrics for the evaluation workflow.
 * Uses bounded tag values to prevent high-cardinality metric explosion.
 */
@Component
public class EvaluationMetrics {

    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter policyAllowed;
    private final Counter policyDenied;
    private final Counter sessionStarted;
    private final Counter sessionConflict;
    private final Counter sessionCompleted;
    private final Counter sessionDeleted;
    private final Counter casesImported;
    private final Counter casesDeleted;
    private final Counter profilesCreated;

    public EvaluationMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.policyAllowed = Counter.builder("authz.decision")
                .tag("result", "allowed")
                .description("Policy decisions that allowed access")
                .register(registry);

        this.policyDenied = Counter.builder("authz.decision")
                .tag("result", "denied")
                .description("Policy decisions that denied access")
                .register(registry);

        this.sessionStarted = Counter.builder("evaluation.session.lifecycle")
                .tag("event", "started")
                .description("Evaluation sessions started")
                .register(registry);

        this.sessionConflict = Counter.builder("evaluation.session.lifecycle")
                .tag("event", "conflict")
                .description("Duplicate session starts rejected")
                .register(registry);

        this.sessionCompleted = Counter.builder("evaluation.session.lifecycle")
                .tag("event", "completed")
                .description("Evaluation sessions completed")
                .register(registry);

        this.sessionDeleted = Counter.builder("evaluation.session.lifecycle")
                .tag("event", "deleted")
                .description("Evaluation sessions deleted")
                .register(registry);

        this.casesImported = Counter.builder("catalog.cases")
                .tag("event", "created")
                .description("Synthetic cases added to the catalog")
                .register(registry);

        this.casesDeleted = Counter.builder("catalog.cases")
                .tag("event", "deleted")
                .description("Synthetic cases removed from the catalog")
                .register(registry);

        this.profilesCreated = Counter.builder("profiles.created")
                .description("Profiles provisioned")
                .register(registry);
    }

    public void recordPolicyDecision(boolean allowed, @Nullable String policyId, @Nullable String action) {
        if (allowed) {
            policyAllowed.increment();
        } else {
            policyDenied.increment();
        }

        registry.counter("authz.decision.detailed",
                Tags.of("result", allowed ? "allowed" : "denied",
                        "policy", sanitizeTag(policyId),
                        "action", sanitizeTag(action)))
                .increment();
    }

    public void recordSessionStarted() {
        sessionStarted.increment();
    }

    public void recordSessionConflict() {
        sessionConflict.increment();
    }

    public void recordSessionCompleted() {
        sessionCompleted.increment();
    }

    public void recordSessionDeleted() {
        sessionDeleted.increment();
    }

    public void recordRatingUpsert(@NonNull String format) {
        registry.counter("evaluation.rating.upsert", Tags.of("format", sanitizeTag(format))).increment();
    }

    public void recordCasesCreated(int count) {
        casesImported.increment(count);
    }

    public void recordCaseDeleted() {
        casesDeleted.increment();
    }

    public void recordProfileCreated(@Nullable String role) {
        profilesCreated.increment();
        registry.counter("profiles.created.by_role", Tags.of("role", sanitizeTag(role))).increment();
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String cleaned = value.replaceAll("[^a-zA-Z0-9_.-]", "_");
        return cleaned.length() > MAX_TAG_LENGTH ? cleaned.substring(0, MAX_TAG_LENGTH) : cleaned;
    }
}
