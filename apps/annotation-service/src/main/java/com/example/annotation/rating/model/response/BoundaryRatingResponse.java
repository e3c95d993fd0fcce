package com.example.annotation.rating.model.response;

import com.example.annotation.rating.document.BoundaryRatingDoc;

import java.time.Instant;

public record BoundaryRatingResponse(
        String sessionId,
        int optionIndex,
        String pnCategory,
        String aiIntendedCategory,
        Instant submittedAt
) {
    public static BoundaryRatingResponse from(BoundaryRatingDoc doc) {
        return new BoundaryRatingResponse(
                doc.getSessionId(),
                doc.getOptionIndex(),
                doc.getPnCategory(),
                doc.getAiIntendedCategory(),
                doc.getSubmittedAt());
    }
}
