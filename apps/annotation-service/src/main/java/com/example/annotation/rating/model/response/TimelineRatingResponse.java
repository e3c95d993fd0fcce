package com.example.annotation.rating.model.response;

import com.example.annotation.rating.document.TimelineRatingDoc;

import java.time.Instant;

public record TimelineRatingResponse(
        String sessionId,
        int eventIndex,
        String clinicalImpact,
        String environmentalImpact,
        String homeServiceAdoptionImpact,
        String eddDelta,
        boolean bottleneckRealism,
        Instant submittedAt
) {
    public static TimelineRatingResponse from(TimelineRatingDoc doc) {
        return new TimelineRatingResponse(
                doc.getSessionId(),
                doc.getEventIndex(),
                doc.getClinicalImpact(),
                doc.getEnvironmentalImpact(),
                doc.getHomeServiceAdoptionImpact(),
                doc.getEddDelta(),
                doc.isBottleneckRealism(),
                doc.getSubmittedAt());
    }
}
