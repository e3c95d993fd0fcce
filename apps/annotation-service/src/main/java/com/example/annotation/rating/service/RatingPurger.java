package com.example.annotation.rating.service;

import com.example.annotation.rating.repository.BoundaryRatingRepository;
import com.example.annotation.rating.repository.TacticRatingRepository;
import com.example.annotation.rating.repository.TimelineRatingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Removes the ratings of all three formats for a set of sessions.
 * Runs inside the caller's transaction; it opens none itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RatingPurger {

    private final TimelineRatingRepository timelineRepository;
    private final TacticRatingRepository tacticRepository;
    private final BoundaryRatingRepository boundaryRepository;

    /**
     * @return total number of ratings removed
     */
    public Mono<Long> purgeSessions(Collection<String> sessionIds) {
        if (sessionIds.isEmpty()) {
            return Mono.just(0L);
        }
        return timelineRepository.deleteBySessionIdIn(sessionIds)
                .zipWith(tacticRepository.deleteBySessionIdIn(sessionIds), Long::sum)
                .zipWith(boundaryRepository.deleteBySessionIdIn(sessionIds), Long::sum)
                .doOnSuccess(count -> log.debug("Purged {} ratings for {} sessions", count, sessionIds.size()));
    }
}
