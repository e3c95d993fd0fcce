package com.example.annotation.rating.service;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.ResourceAttributes.ResourceType;
import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.common.exception.InvalidArgumentException;
import com.example.annotation.common.exception.InvalidStateException;
import com.example.annotation.common.exception.NotFoundException;
import com.example.annotation.common.util.RetryUtils;
import com.example.annotation.common.util.StringSanitizer;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.document.EvaluationSessionDoc;
import com.example.annotation.evaluation.model.SessionStatus;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.security.context.CallerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Shared behaviour of the three format scorers.
 *
 * <p>Ratings are keyed by {@code (sessionId, index)} through the deterministic id
 * {@code <sessionId>:<index>}, so a second submission for the same index replaces
 * the first. Access is decided by the owner of the parent session.
 *
 * <p>Every write runs in one transaction that first bumps the parent session with
 * a conditional {@code status = IN_PROGRESS} update and then writes the rating.
 * A completion that lands first makes the write fail with
 * {@link InvalidStateException}; a completion that lands second waits for the
 * transaction to commit. Write conflicts between two rating transactions on the
 * same session abort one of them with a transient error, which reruns the
 * transaction a bounded number of times.
 *
 * @param <D> rating document
 * @param <Q> upsert request
 * @param <R> response
 */
@Slf4j
public abstract class FormatScorer<D, Q, R> {

    private final ReactiveMongoRepository<D, String> ratingRepository;
    private final EvaluationSessionRepository sessionRepository;
    private final AccessPolicyService accessPolicyService;
    private final TransactionalOperator transactionalOperator;
    private final EvaluationMetrics metrics;
    private final int retryAttempts;
    private final Duration retryBackoff;

    protected FormatScorer(ReactiveMongoRepository<D, String> ratingRepository,
                           EvaluationSessionRepository sessionRepository,
                           AccessPolicyService accessPolicyService,
                           TransactionalOperator transactionalOperator,
                           EvaluationMetrics metrics,
                           AnnotationProperties properties) {
        this.ratingRepository = ratingRepository;
        this.sessionRepository = sessionRepository;
        this.accessPolicyService = accessPolicyService;
        this.transactionalOperator = transactionalOperator;
        this.metrics = metrics;
        this.retryAttempts = properties.getStore().getTransientRetryAttempts();
        this.retryBackoff = Duration.ofMillis(properties.getStore().getTransientRetryBackoffMillis());
    }

    /**
     * Resource type used for policy checks and audit.
     */
    protected abstract ResourceType resourceType();

    /**
     * Short name for logs and metrics, e.g. {@code timeline}.
     */
    protected abstract String formatName();

    /**
     * Field-level checks; throws {@link InvalidArgumentException}.
     */
    protected abstract void validate(Q request);

    protected abstract D toDocument(String ratingId, String sessionId, int index, Q request, Instant submittedAt);

    protected abstract Flux<D> findBySession(String sessionId);

    protected abstract R toResponse(D doc);

    public static String ratingId(String sessionId, int index) {
        return sessionId + ":" + index;
    }

    /**
     * Creates or replaces the rating at {@code index}.
     */
    public Mono<R> upsertRating(CallerContext caller, String sessionId, int index, Q request) {
        String ratingId = ratingId(sessionId, index);

        return Mono.fromRunnable(() -> {
                    validateIndex(index);
                    if (request == null) {
                        throw new InvalidArgumentException("body", "Rating fields are required");
                    }
                    validate(request);
                })
                .then(Mono.defer(() -> loadAuthorized(caller, sessionId, ratingId, Action.UPDATE)))
                .flatMap(session -> {
                    requireOpen(session);
                    return inSessionTransaction(sessionId, Mono.defer(() ->
                            ratingRepository.save(toDocument(ratingId, sessionId, index, request, Instant.now()))));
                })
                .doOnNext(saved -> metrics.recordRatingUpsert(formatName()))
                .map(this::toResponse)
                .doOnSuccess(resp -> log.debug("Upserted {} rating {}", formatName(), StringSanitizer.forLog(ratingId)))
                .doOnError(e -> log.warn("Failed to upsert {} rating {}: {}",
                        formatName(), StringSanitizer.forLog(ratingId), e.getMessage()));
    }

    public Flux<R> listRatings(CallerContext caller, String sessionId) {
        return loadAuthorized(caller, sessionId, "*", Action.SELECT)
                .flatMapMany(session -> findBySession(sessionId))
                .map(this::toResponse);
    }

    public Mono<R> getRating(CallerContext caller, String sessionId, int index) {
        String ratingId = ratingId(sessionId, index);
        return loadAuthorized(caller, sessionId, ratingId, Action.SELECT)
                .then(Mono.defer(() -> ratingRepository.findById(ratingId)))
                .switchIfEmpty(Mono.error(new NotFoundException(resourceType().name(), ratingId)))
                .map(this::toResponse);
    }

    /**
     * Removes one rating. Same session-state rule as writes.
     */
    public Mono<Void> deleteRating(CallerContext caller, String sessionId, int index) {
        String ratingId = ratingId(sessionId, index);

        return loadAuthorized(caller, sessionId, ratingId, Action.DELETE)
                .flatMap(session -> {
                    requireOpen(session);
                    return inSessionTransaction(sessionId, Mono.defer(() ->
                            ratingRepository.findById(ratingId)
                                    .switchIfEmpty(Mono.error(new NotFoundException(resourceType().name(), ratingId)))
                                    .flatMap(existing -> ratingRepository.deleteById(ratingId).thenReturn(existing))));
                })
                .doOnSuccess(deleted -> log.debug("Deleted {} rating {}", formatName(), StringSanitizer.forLog(ratingId)))
                .then();
    }

    /**
     * Authorizes against the owner of the parent session. A missing session has no
     * owner, so non-admins are denied before its absence is revealed.
     */
    private Mono<EvaluationSessionDoc> loadAuthorized(CallerContext caller, String sessionId,
                                                      String ratingId, Action action) {
        return sessionRepository.findById(sessionId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> accessPolicyService.authorize(caller,
                                ResourceAttributes.rating(resourceType(), ratingId, sessionId,
                                        found.map(EvaluationSessionDoc::getNavigatorId).orElse(null)),
                                action)
                        .then(Mono.justOrEmpty(found)))
                .switchIfEmpty(Mono.error(new NotFoundException("EvaluationSession", sessionId)));
    }

    private <T> Mono<T> inSessionTransaction(String sessionId, Mono<T> write) {
        Mono<T> work = Mono.defer(() -> sessionRepository.touchIfInProgress(sessionId, Instant.now()))
                .flatMap(modified -> modified > 0 ? write : sessionNoLongerOpen(sessionId));

        return Mono.defer(() -> transactionalOperator.transactional(work))
                .retryWhen(RetryUtils.transientTransactionRetry(retryAttempts, retryBackoff,
                        "Concurrent writes on session " + sessionId + ", please resubmit"));
    }

    private <T> Mono<T> sessionNoLongerOpen(String sessionId) {
        return sessionRepository.findById(sessionId)
                .switchIfEmpty(Mono.error(new NotFoundException("EvaluationSession", sessionId)))
                .flatMap(current -> Mono.error(new InvalidStateException(sessionId, current.getStatus().value(),
                        "Session " + sessionId + " is " + current.getStatus().value())));
    }

    private static void requireOpen(EvaluationSessionDoc session) {
        if (session.getStatus() != SessionStatus.IN_PROGRESS) {
            throw new InvalidStateException(session.getId(), session.getStatus().value(),
                    "Ratings cannot change once session " + session.getId() + " is " + session.getStatus().value());
        }
    }

    private static void validateIndex(int index) {
        if (index < 0) {
            throw new InvalidArgumentException("index", "Index must be zero or greater");
        }
    }

    protected static void requireText(String value, String field) {
        if (value == null) {
            throw new InvalidArgumentException(field, field + " is required");
        }
    }
}
