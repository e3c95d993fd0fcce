package com.example.annotation.rating.service;

import com.example.annotation.rating.model.response.SessionRatingsResponse;
import com.example.annotation.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Reads all three formats of a session at once. Each format is authorized on its own.
 */
@Service
@RequiredArgsConstructor
public class SessionRatingsService {

    private final TimelineRatingScorer timelineScorer;
    private final TacticRatingScorer tacticScorer;
    private final BoundaryRatingScorer boundaryScorer;

    public Mono<SessionRatingsResponse> getSessionRatings(CallerContext caller, String sessionId) {
        return Mono.zip(
                        timelineScorer.listRatings(caller, sessionId).collectList(),
                        tacticScorer.listRatings(caller, sessionId).collectList(),
                        boundaryScorer.listRatings(caller, sessionId).collectList())
                .map(tuple -> new SessionRatingsResponse(sessionId, tuple.getT1(), tuple.getT2(), tuple.getT3()));
    }
}
