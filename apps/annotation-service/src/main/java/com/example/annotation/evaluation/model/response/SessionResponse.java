package com.example.annotation.evaluation.model.response;

import com.example.annotation.evaluation.document.EvaluationSessionDoc;
import com.example.annotation.evaluation.model.SessionStatus;

import java.time.Instant;

public record SessionResponse(
        String id,
        String caseId,
        String caseLabel,
        String navigatorId,
        String navigatorName,
        SessionStatus status,
        Integer overallFieldAuthenticity,
        Instant createdAt,
        Instant completedAt,
        Instant lastActivityAt
) {
    public static SessionResponse from(EvaluationSessionDoc doc) {
        return new SessionResponse(
                doc.getId(),
                doc.getCaseId(),
                doc.getCaseLabel(),
                doc.getNavigatorId(),
                doc.getNavigatorName(),
                doc.getStatus(),
                doc.getOverallFieldAuthenticity(),
                doc.getCreatedAt(),
                doc.getCompletedAt(),
                doc.getLastActivityAt());
    }
}
