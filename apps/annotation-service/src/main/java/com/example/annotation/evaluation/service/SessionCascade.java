package com.example.annotation.evaluation.service;

import com.example.annotation.common.util.StringSanitizer;
import com.example.annotation.evaluation.document.EvaluationSessionDoc;
import com.example.annotation.evaluation.repository.EvaluationSessionRepository;
import com.example.annotation.rating.service.RatingPurger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Deletes sessions together with their ratings.
 *
 * <p>None of these methods are authorized or transactional on their own; the
 * owning service checks access and wraps the call in its transaction so the
 * whole cascade commits or rolls back as one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCascade {

    private final EvaluationSessionRepository sessionRepository;
    private final RatingPurger ratingPurger;

    public Mono<Void> deleteSession(String sessionId) {
        return ratingPurger.purgeSessions(List.of(sessionId))
                .then(Mono.defer(() -> sessionRepository.deleteById(sessionId)));
    }

    /**
     * @return number of sessions removed
     */
    public Mono<Long> deleteSessionsForCase(String caseId) {
        return sessionRepository.findByCaseId(caseId)
                .map(EvaluationSessionDoc::getId)
                .collectList()
                .flatMap(ids -> ratingPurger.purgeSessions(ids)
                        .then(Mono.defer(() -> sessionRepository.deleteByCaseId(caseId))))
                .doOnSuccess(count -> log.info("Cascaded delete of {} sessions for case={}", count, StringSanitizer.forLog(caseId)));
    }

    /**
     * @return number of sessions removed
     */
    public Mono<Long> deleteSessionsForNavigator(String navigatorId) {
        return sessionRepository.findByNavigatorId(navigatorId)
                .map(EvaluationSessionDoc::getId)
                .collectList()
                .flatMap(ids -> ratingPurger.purgeSessions(ids)
                        .then(Mono.defer(() -> sessionRepository.deleteByNavigatorId(navigatorId))))
                .doOnSuccess(count -> log.info("Cascaded delete of {} sessions for navigator={}", count, StringSanitizer.forLog(navigatorId)));
    }
}
