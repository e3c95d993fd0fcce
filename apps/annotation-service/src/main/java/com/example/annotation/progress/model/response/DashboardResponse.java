package com.example.annotation.progress.model.response;

import com.example.annotation.evaluation.model.SessionStatus;

import java.time.Instant;
import java.util.List;

/**
 * A navigator's work queue, each list ordered by the number in the case label.
 */
public record DashboardResponse(
        String navigatorId,
        String navigatorName,
        List<Entry> inProgress,
        List<Entry> pending,
        List<Entry> completed
) {
    /**
     * @param sessionId null for pending cases
     * @param summary   narrative preview
     */
    public record Entry(
            String caseId,
            String caseLabel,
            String sessionId,
            SessionStatus status,
            String summary,
            Instant completedAt
    ) {}
}
