package com.example.annotation.rating.service;

import com.example.annotation.authz.model.ResourceAttributes.ResourceType;
import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.rating.document.BoundaryRatingDoc;
import com.example.annotation.rating.model.request.BoundaryRatingRequest;
import com.example.annotation.rating.model.response.BoundaryRatingResponse;
import com.example.annotation.rating.repository.BoundaryRatingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Format 3 scorer: category labels per RL-scenario option. Labels are not checked
 * against any vocabulary.
 */
@Service
public class BoundaryRatingScorer extends FormatScorer<BoundaryRatingDoc, BoundaryRatingRequest, BoundaryRatingResponse> {

    private final BoundaryRatingRepository repository;

    public BoundaryRatingScorer(BoundaryRatingRepository repository,
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
        return ResourceType.FORMAT3_RATING;
    }

    @Override
    protected String formatName() {
        return "boundaries";
    }

    @Override
    protected void validate(BoundaryRatingRequest request) {
        requireText(request.pnCategory(), "pnCategory");
        requireText(request.aiIntendedCategory(), "aiIntendedCategory");
    }

    @Override
    protected BoundaryRatingDoc toDocument(String ratingId, String sessionId, int index,
                                           BoundaryRatingRequest request, Instant submittedAt) {
        return BoundaryRatingDoc.builder()
                .id(ratingId)
                .sessionId(sessionId)
                .optionIndex(index)
                .pnCategory(request.pnCategory())
                .aiIntendedCategory(request.aiIntendedCategory())
                .submittedAt(submittedAt)
                .build();
    }

    @Override
    protected Flux<BoundaryRatingDoc> findBySession(String sessionId) {
        return repository.findBySessionIdOrderByOptionIndexAsc(sessionId);
    }

    @Override
    protected BoundaryRatingResponse toResponse(BoundaryRatingDoc doc) {
        return BoundaryRatingResponse.from(doc);
    }
}
