package com.example.annotation.evaluation.service;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.service.AccessPolicyService;
import com.example.annotation.cases.repository.SyntheticCaseRepository;
import com.example.annotation.common.exception.ConflictException;
import com.example.annotation.common.exception.InvalidArgumentException;
import com.example.annotation.common.exception.InvalidStateException;
import com.example.annotation.common.exception.NotFoundException;
import com.example.annotation.common.util.RetryUtils;
import com.example.annotation.common.util.StringSanitizer;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.evaluation.document.EvaluationSessionDoc;
import com.example.annotation.evaluation.model.SessionStatus;
import com.example.annotation.evaluation.model.request.StartSessionRequest;
import com.example.annotation.evaluation.model.response.SessionResponse;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.observability.metrics.EvaluationMetrics;
import com.example.annotation.profile.repository.ProfileRepository;
import com.example.annotation.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Session Manager: binds one navigator to one case and drives the
 * {@code in_progress -> completed} lifecycle.
 *
 * <p>Access is decided before existence is revealed. A session the caller
 * cannot see and a session that does not exist both fail with
 * {@code ForbiddenException}; only administrators get {@link NotFoundException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionManager {

    static final String RESOURCE = "EvaluationSession";
    private static final int MIN_SCORE = 1;
    private static final int MAX_SCORE = 5;

    private final EvaluationSessionRepository sessionRepository;
    private final SyntheticCaseRepository caseRepository;
    private final ProfileRepository profileRepository;
    private final AccessPolicyService accessPolicyService;
    private final SessionCascade sessionCascade;
    private final TransactionalOperator transactionalOperator;
    private final EvaluationMetrics metrics;
    private final AnnotationProperties properties;

    /**
     * Starts a session. Uniqueness of (case, navigator) is enforced by the store's
     * unique index, so of two concurrent starts exactly one wins.
     *
     * <p>The insert runs in one transaction with a revision bump on the case and
     * the navigator profile. A concurrent delete of either parent writes the same
     * document, so the two transactions conflict instead of leaving a session
     * behind that points at a deleted case or navigator.
     */
    public Mono<SessionResponse> startSession(CallerContext caller, StartSessionRequest request) {
        String navigatorId = request.navigatorId() != null && !request.navigatorId().isBlank()
                ? request.navigatorId().trim()
                : caller.callerId();

        return accessPolicyService.authorize(caller, ResourceAttributes.session("new", navigatorId), Action.INSERT)
                .then(Mono.defer(() -> insertWithParents(navigatorId, request.caseId())))
                .onErrorMap(DuplicateKeyException.class, e -> {
                    metrics.recordSessionConflict();
                    return new ConflictException(String.format(
                            "A session already exists for case %s and navigator %s", request.caseId(), navigatorId), e);
                })
                .doOnNext(saved -> metrics.recordSessionStarted())
                .map(SessionResponse::from)
                .doOnSuccess(resp -> log.info("Started session: id={}, case={}, navigator={}",
                        resp.id(), resp.caseId(), StringSanitizer.forLog(navigatorId)))
                .doOnError(e -> log.warn("Failed to start session for case={}, navigator={}: {}",
                        StringSanitizer.forLog(request.caseId()), StringSanitizer.forLog(navigatorId), e.getMessage()));
    }

    private Mono<EvaluationSessionDoc> insertWithParents(String navigatorId, String caseId) {
        Mono<EvaluationSessionDoc> work = Mono.defer(() -> profileRepository.touchRevision(navigatorId))
                .filter(modified -> modified > 0)
                .flatMap(modified -> profileRepository.findById(navigatorId))
                .switchIfEmpty(Mono.error(new NotFoundException("Profile", navigatorId)))
                .zipWhen(navigator -> caseRepository.touchRevision(caseId)
                        .filter(modified -> modified > 0)
                        .flatMap(modified -> caseRepository.findById(caseId))
                        .switchIfEmpty(Mono.error(new NotFoundException("SyntheticCase", caseId))))
                .flatMap(tuple -> {
                    Instant now = Instant.now();
                    EvaluationSessionDoc doc = EvaluationSessionDoc.builder()
                            .caseId(tuple.getT2().getId())
                            .caseLabel(tuple.getT2().getLabel())
                            .navigatorId(navigatorId)
                            .navigatorName(tuple.getT1().getFullName())
                            .status(SessionStatus.IN_PROGRESS)
                            .lastActivityAt(now)
                            .revision(0)
                            .build();
                    return sessionRepository.insert(doc);
                });

        return Mono.defer(() -> transactionalOperator.transactional(work))
                .retryWhen(RetryUtils.transientTransactionRetry(
                        properties.getStore().getTransientRetryAttempts(),
                        Duration.ofMillis(properties.getStore().getTransientRetryBackoffMillis()),
                        "Case " + caseId + " or navigator " + navigatorId + " changed concurrently, please retry"));
    }

    public Mono<SessionResponse> getSession(CallerContext caller, String sessionId) {
        return loadAuthorized(caller, sessionId, Action.SELECT)
                .map(SessionResponse::from);
    }

    /**
     * Navigators list their own sessions; admins list all, optionally for one navigator.
     */
    public Flux<SessionResponse> listSessions(CallerContext caller,
                                              @Nullable String navigatorId,
                                              @Nullable SessionStatus status) {
        return accessPolicyService.resolveSubject(caller)
                .flatMap(subject -> {
                    String effective = subject.isAdmin() || navigatorId != null ? navigatorId : caller.callerId();
                    ResourceAttributes resource = ResourceAttributes.session("*", effective);
                    return accessPolicyService.check(subject, resource, Action.SELECT, caller.correlationId())
                            .thenReturn(Optional.ofNullable(effective));
                })
                .flatMapMany(effective -> effective
                        .map(id -> status != null
                                ? sessionRepository.findByNavigatorIdAndStatusOrderByCreatedAtDesc(id, status)
                                : sessionRepository.findByNavigatorIdOrderByCreatedAtDesc(id))
                        .orElseGet(() -> status != null
                                ? sessionRepository.findByStatusOrderByCreatedAtDesc(status)
                                : sessionRepository.findAllByOrderByCreatedAtDesc()))
                .map(SessionResponse::from);
    }

    /**
     * Records the overall score. Only while the session is in progress.
     */
    public Mono<SessionResponse> submitOverallScore(CallerContext caller, String sessionId, Integer score) {
        return Mono.fromRunnable(() -> validateScore(score))
                .then(Mono.defer(() -> loadAuthorized(caller, sessionId, Action.UPDATE)))
                .flatMap(session -> sessionRepository.setOverallScoreIfInProgress(sessionId, score, Instant.now()))
                .flatMap(modified -> reloadAfterConditionalUpdate(sessionId, modified))
                .map(SessionResponse::from)
                .doOnSuccess(resp -> log.info("Overall score submitted: session={}, score={}", resp.id(), score))
                .doOnError(e -> log.warn("Failed to submit overall score for session={}: {}",
                        StringSanitizer.forLog(sessionId), e.getMessage()));
    }

    /**
     * Moves the session to {@code completed} and stamps {@code completedAt}.
     * Terminal: a second completion fails with {@link InvalidStateException}.
     *
     * @param score optional overall score, written in the same update
     */
    public Mono<SessionResponse> completeSession(CallerContext caller, String sessionId, @Nullable Integer score) {
        return Mono.fromRunnable(() -> {
                    if (score != null) {
                        validateScore(score);
                    }
                })
                .then(Mono.defer(() -> loadAuthorized(caller, sessionId, Action.UPDATE)))
                .flatMap(session -> {
                    Instant now = Instant.now();
                    return score != null
                            ? sessionRepository.completeWithScoreIfInProgress(sessionId, score, now)
                            : sessionRepository.completeIfInProgress(sessionId, now);
                })
                .flatMap(modified -> reloadAfterConditionalUpdate(sessionId, modified))
                .doOnNext(completed -> metrics.recordSessionCompleted())
                .map(SessionResponse::from)
                .doOnSuccess(resp -> log.info("Completed session: id={}, navigator={}",
                        resp.id(), StringSanitizer.forLog(resp.navigatorId())))
                .doOnError(e -> log.warn("Failed to complete session={}: {}",
                        StringSanitizer.forLog(sessionId), e.getMessage()));
    }

    /**
     * Deletes the session and its ratings in one transaction.
     */
    public Mono<Void> deleteSession(CallerContext caller, String sessionId) {
        return loadAuthorized(caller, sessionId, Action.DELETE)
                .flatMap(session -> transactionalOperator.transactional(sessionCascade.deleteSession(sessionId))
                        .thenReturn(session))
                .doOnNext(deleted -> metrics.recordSessionDeleted())
                .doOnSuccess(deleted -> log.info("Deleted session: id={}", StringSanitizer.forLog(sessionId)))
                .then();
    }

    /**
     * Looks up the session, authorizes against its real owner (null when missing)
     * and only then reports absence.
     */
    Mono<EvaluationSessionDoc> loadAuthorized(CallerContext caller, String sessionId, Action action) {
        return sessionRepository.findById(sessionId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> accessPolicyService.authorize(caller,
                                ResourceAttributes.session(sessionId,
                                        found.map(EvaluationSessionDoc::getNavigatorId).orElse(null)),
                                action)
                        .then(Mono.justOrEmpty(found)))
                .switchIfEmpty(Mono.error(new NotFoundException(RESOURCE, sessionId)));
    }

    /**
     * A conditional update that touched nothing means the session was deleted or
     * already completed between the lookup and the write.
     */
    private Mono<EvaluationSessionDoc> reloadAfterConditionalUpdate(String sessionId, long modified) {
        return sessionRepository.findById(sessionId)
                .switchIfEmpty(Mono.error(new NotFoundException(RESOURCE, sessionId)))
                .flatMap(current -> {
                    if (modified == 0) {
                        return Mono.error(new InvalidStateException(sessionId, current.getStatus().value(),
                                "Session " + sessionId + " is " + current.getStatus().value()));
                    }
                    return Mono.just(current);
                });
    }

    private static void validateScore(Integer score) {
        if (score == null || score < MIN_SCORE || score > MAX_SCORE) {
            throw new InvalidArgumentException("overallFieldAuthenticity",
                    "Overall field authenticity must be between " + MIN_SCORE + " and " + MAX_SCORE);
        }
    }
}
