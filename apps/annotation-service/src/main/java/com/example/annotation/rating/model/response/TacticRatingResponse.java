package com.example.annotation.rating.model.response;

import com.example.annotation.rating.document.TacticRatingDoc;

import java.time.Instant;

public record TacticRatingResponse(
        String sessionId,
        int tripleIndex,
        int intentFeasibilityScore,
        Instant submittedAt
) {
    public static TacticRatingResponse from(TacticRatingDoc doc) {
        return new TacticRatingResponse(
                doc.getSessionId(),
                doc.getTripleIndex(),
                doc.getIntentFeasibilityScore(),
                doc.getSubmittedAt());
    }
}
