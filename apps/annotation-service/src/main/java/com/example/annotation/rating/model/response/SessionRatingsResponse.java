package com.example.annotation.rating.model.response;

import java.util.List;

/**
 * All ratings of one session, each format ordered by index.
 */
public record SessionRatingsResponse(
        String sessionId,
        List<TimelineRatingResponse> timeline,
        List<TacticRatingResponse> tactics,
        List<BoundaryRatingResponse> boundaries
) {}
