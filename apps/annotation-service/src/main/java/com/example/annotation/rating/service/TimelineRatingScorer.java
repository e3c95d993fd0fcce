package com.example.annotation.rating.service;

import com.example.annotation.authz.model.ResourceAttributes.ResourceType;
import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.common.exception.InvalidArgumentException;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.rating.document.TimelineRatingDoc;
import com.example.annotation.rating.model.request.TimelineRatingRequest;
import com.example.annotation.rating.model.response.TimelineRatingResponse;
import com.example.annotation.rating.repository.TimelineRatingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Format 1 scorer: one rating per state-log event.
 */
@Service
public class TimelineRatingScorer extends FormatScorer<TimelineRatingDoc, TimelineRatingRequest, TimelineRatingResponse> {

    private final TimelineRatingRepository repository;

    public TimelineRatingScorer(TimelineRatingRepository repository,
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
        return ResourceType.FORMAT1_RATING;
    }

    @Override
    protected String formatName() {
        return "timeline";
    }

    @Override
    protected void validate(TimelineRatingRequest request) {
        requireText(request.clinicalImpact(), "clinicalImpact");
        requireText(request.environmentalImpact(), "environmentalImpact");
        requireText(request.homeServiceAdoptionImpact(), "homeServiceAdoptionImpact");
        requireText(request.eddDelta(), "eddDelta");
        if (request.bottleneckRealism() == null) {
            throw new InvalidArgumentException("bottleneckRealism", "bottleneckRealism must be true or false");
        }
    }

    @Override
    protected TimelineRatingDoc toDocument(String ratingId, String sessionId, int index,
                                           TimelineRatingRequest request, Instant submittedAt) {
        return TimelineRatingDoc.builder()
                .id(ratingId)
                .sessionId(sessionId)
                .eventIndex(index)
                .clinicalImpact(request.clinicalImpact())
                .environmentalImpact(request.environmentalImpact())
                .homeServiceAdoptionImpact(request.homeServiceAdoptionImpact())
                .eddDelta(request.eddDelta())
                .bottleneckRealism(request.bottleneckRealism())
                .submittedAt(submittedAt)
                .build();
    }

    @Override
    protected Flux<TimelineRatingDoc> findBySession(String sessionId) {
        return repository.findBySessionIdOrderByEventIndexAsc(sessionId);
    }

    @Override
    protected TimelineRatingResponse toResponse(TimelineRatingDoc doc) {
        return TimelineRatingResponse.from(doc);
    }
}
