package com.example.annotation.evaluation.repository;

import com.example.annotation.evaluation.document.EvaluationSessionDoc;
import com.example.annotation.evaluation.model.SessionStatus;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Repository for evaluation sessions.
 *
 * <p>The {@code *IfInProgress} methods are single conditional updates: the status
 * check and the write happen in one store operation. They return the number of
 * modified documents, so 0 means the session is gone or no longer in progress.
 * Each also bumps {@code revision}, which guarantees a matched document is modified.
 */
@Repository
public interface EvaluationSessionRepository extends ReactiveMongoRepository<EvaluationSessionDoc, String> {

    Flux<EvaluationSessionDoc> findAllByOrderByCreatedAtDesc();

    Flux<EvaluationSessionDoc> findByStatusOrderByCreatedAtDesc(SessionStatus status);

    Flux<EvaluationSessionDoc> findByNavigatorIdOrderByCreatedAtDesc(String navigatorId);

    Flux<EvaluationSessionDoc> findByNavigatorIdAndStatusOrderByCreatedAtDesc(String navigatorId, SessionStatus status);

    Flux<EvaluationSessionDoc> findByCaseId(String caseId);

    Flux<EvaluationSessionDoc> findByNavigatorId(String navigatorId);

    Mono<Long> countByNavigatorIdAndStatus(String navigatorId, SessionStatus status);

    Mono<Long> deleteByCaseId(String caseId);

    Mono<Long> deleteByNavigatorId(String navigatorId);

    @Query("{ '_id': ?0, 'status': 'IN_PROGRESS' }")
    @Update("{ '$set': { 'overallFieldAuthenticity': ?1, 'lastActivityAt': ?2 }, '$inc': { 'revision': 1 } }")
    Mono<Long> setOverallScoreIfInProgress(String id, int score, Instant at);

    @Query("{ '_id': ?0, 'status': 'IN_PROGRESS' }")
    @Update("{ '$set': { 'status': 'COMPLETED', 'completedAt': ?1, 'lastActivityAt': ?1 }, '$inc': { 'revision': 1 } }")
    Mono<Long> completeIfInProgress(String id, Instant completedAt);

    @Query("{ '_id': ?0, 'status': 'IN_PROGRESS' }")
    @Update("{ '$set': { 'status': 'COMPLETED', 'overallFieldAuthenticity': ?1, 'completedAt': ?2, 'lastActivityAt': ?2 }, '$inc': { 'revision': 1 } }")
    Mono<Long> completeWithScoreIfInProgress(String id, int score, Instant completedAt);

    /**
     * Write-locks an open session inside a rating transaction.
     */
    @Query("{ '_id': ?0, 'status': 'IN_PROGRESS' }")
    @Update("{ '$set': { 'lastActivityAt': ?1 }, '$inc': { 'revision': 1 } }")
    Mono<Long> touchIfInProgress(String id, Instant at);
}
