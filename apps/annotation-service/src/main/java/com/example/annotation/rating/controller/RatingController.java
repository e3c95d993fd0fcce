package com.example.annotation.rating.controller;

import com.example.annotation.rating.model.request.BoundaryRatingRequest;
import com.example.annotation.rating.model.request.TacticRatingRequest;
import com.example.annotation.rating.model.request.TimelineRatingRequest;
import com.example.annotation.rating.model.response.BoundaryRatingResponse;
import com.example.annotation.rating.model.response.SessionRatingsResponse;
import com.example.annotation.rating.model.response.TacticRatingResponse;
import com.example.annotation.rating.model.response.TimelineRatingResponse;
import com.example.annotation.rating.service.BoundaryRatingScorer;
import com.example.annotation.rating.service.SessionRatingsService;
import com.example.annotation.rating.service.TacticRatingScorer;
import com.example.annotation.rating.service.TimelineRatingScorer;
import com.example.annotation.security.annotation.ResolvedCaller;
import com.example.annotation.security.context.CallerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Ratings of the three formats, nested under their session.
 * Index path variables are the event, triple and option positions in the case payload.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}/ratings")
@RequiredArgsConstructor
public class RatingController {

    private final TimelineRatingScorer timelineScorer;
    private final TacticRatingScorer tacticScorer;
    private final BoundaryRatingScorer boundaryScorer;
    private final SessionRatingsService sessionRatingsService;

    @GetMapping
    public Mono<SessionRatingsResponse> getSessionRatings(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId) {

        return sessionRatingsService.getSessionRatings(caller, sessionId);
    }

    // Format 1

    @GetMapping("/timeline")
    public Flux<TimelineRatingResponse> listTimelineRatings(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId) {

        return timelineScorer.listRatings(caller, sessionId);
    }

    @GetMapping("/timeline/{eventIndex}")
    public Mono<TimelineRatingResponse> getTimelineRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int eventIndex) {

        return timelineScorer.getRating(caller, sessionId, eventIndex);
    }

    @PutMapping("/timeline/{eventIndex}")
    public Mono<TimelineRatingResponse> upsertTimelineRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int eventIndex,
            @Valid @RequestBody TimelineRatingRequest request) {

        log.debug("PUT /sessions/{}/ratings/timeline/{} - caller: {}", sessionId, eventIndex, caller.callerId());
        return timelineScorer.upsertRating(caller, sessionId, eventIndex, request);
    }

    @DeleteMapping("/timeline/{eventIndex}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteTimelineRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int eventIndex) {

        return timelineScorer.deleteRating(caller, sessionId, eventIndex);
    }

    // Format 2

    @GetMapping("/tactics")
    public Flux<TacticRatingResponse> listTacticRatings(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId) {

        return tacticScorer.listRatings(caller, sessionId);
    }

    @GetMapping("/tactics/{tripleIndex}")
    public Mono<TacticRatingResponse> getTacticRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int tripleIndex) {

        return tacticScorer.getRating(caller, sessionId, tripleIndex);
    }

    @PutMapping("/tactics/{tripleIndex}")
    public Mono<TacticRatingResponse> upsertTacticRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int tripleIndex,
            @RequestBody TacticRatingRequest request) {

        log.debug("PUT /sessions/{}/ratings/tactics/{} - caller: {}", sessionId, tripleIndex, caller.callerId());
        return tacticScorer.upsertRating(caller, sessionId, tripleIndex, request);
    }

    @DeleteMapping("/tactics/{tripleIndex}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteTacticRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int tripleIndex) {

        return tacticScorer.deleteRating(caller, sessionId, tripleIndex);
    }

    // Format 3

    @GetMapping("/boundaries")
    public Flux<BoundaryRatingResponse> listBoundaryRatings(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId) {

        return boundaryScorer.listRatings(caller, sessionId);
    }

    @GetMapping("/boundaries/{optionIndex}")
    public Mono<BoundaryRatingResponse> getBoundaryRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int optionIndex) {

        return boundaryScorer.getRating(caller, sessionId, optionIndex);
    }

    @PutMapping("/boundaries/{optionIndex}")
    public Mono<BoundaryRatingResponse> upsertBoundaryRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int optionIndex,
            @Valid @RequestBody BoundaryRatingRequest request) {

        log.debug("PUT /sessions/{}/ratings/boundaries/{} - caller: {}", sessionId, optionIndex, caller.callerId());
        return boundaryScorer.upsertRating(caller, sessionId, optionIndex, request);
    }

    @DeleteMapping("/boundaries/{optionIndex}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteBoundaryRating(
            @ResolvedCaller CallerContext caller,
            @PathVariable String sessionId,
            @PathVariable int optionIndex) {

        return boundaryScorer.deleteRating(caller, sessionId, optionIndex);
    }
}
