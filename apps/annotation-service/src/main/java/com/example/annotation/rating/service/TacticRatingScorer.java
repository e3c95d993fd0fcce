package com.example.annotation.rating.service;

import com.example.annotation.authz.model.ResourceAttributes.ResourceType;
import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.common.exception.InvalidArgumentException;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.rating.document.TacticRatingDoc;
import com.example.annotation.rating.model.request.TacticRatingRequest;
import com.example.annotation.rating.model.response.TacticRatingResponse;
import com.example.annotation.rating.repository.TacticRatingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Format 2 scorer: intent feasibility (1..5) per tactic triple.
 */
@Service
public class TacticRatingScorer extends FormatScorer<TacticRatingDoc, TacticRatingRequest, TacticRatingResponse> {

    private static final int MIN_SCORE = 1;
    private static final int MAX_SCORE = 5;

    private final TacticRatingRepository repository;

    public TacticRatingScorer(TacticRatingRepository repository,
                              EvaluationSessionRepository sessionRepository,
                              AccessPolicyService accessPolicyService,
                              TransactionalOperator transactionalOperator,
                              EvaluationMetrics metrics,
                              AnnotationProperties properties) {
        super(repository, sessionRepository, accessPolicyService, transactionalOperator, metrics, properties);
        this.repository = repository;
    }

    @Override
    protected ResourceType resourceType() {
        return ResourceType.FORMAT2_RATING;
    }

    @Override
    protected String formatName() {
        return "tactics";
    }

    @Override
    protected void validate(TacticRatingRequest request) {
        Integer score = request.intentFeasibilityScore();
        if (score == null || score < MIN_SCORE || score > MAX_SCORE) {
            throw new InvalidArgumentException("intentFeasibilityScore",
                    "Intent feasibility score must be between " + MIN_SCORE + " and " + MAX_SCORE);
        }
    }

    @Override
    protected TacticRatingDoc toDocument(String ratingId, String sessionId, int index,
                                         TacticRatingRequest request, Instant submittedAt) {
        return TacticRatingDoc.builder()
                .id(ratingId)
                .sessionId(sessionId)
                .tripleIndex(index)
                .intentFeasibilityScore(request.intentFeasibilityScore())
                .submittedAt(submittedAt)
                .build();
    }

    @Override
    protected Flux<TacticRatingDoc> findBySession(String sessionId) {
        return repository.findBySessionIdOrderByTripleIndexAsc(sessionId);
    }

    @Override
    protected TacticRatingResponse toResponse(TacticRatingDoc doc) {
        return TacticRatingResponse.from(doc);
    }
}
