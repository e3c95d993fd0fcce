package com.example.annotation.util;

import com.example.annotation.evaluation.document.EvaluationSessionDoc;
import com.example.annotation.evaluation.model.SessionStatus;

import java.time.Instant;

/**
 * Test builder for EvaluationSessionDoc.
 */
public class SessionDocTestBuilder {

    private String id = "S";
    private String caseId = "case-x";
    private String caseLabel = "Case_1";
    private String navigatorId = CallerContextTestBuilder.NAVIGATOR_1;
    private String navigatorName = "Nora Navigator";
    private SessionStatus status = SessionStatus.IN_PROGRESS;
    private Integer overallFieldAuthenticity;
    private Instant completedAt;

    public static SessionDocTestBuilder aSession() {
        return new SessionDocTestBuilder();
    }

    public SessionDocTestBuilder withId(String id) {
        this.id = id;
        return this;
    }

    public SessionDocTestBuilder withCaseId(String caseId) {
        this.caseId = caseId;
        return this;
    }

    public SessionDocTestBuilder withCaseLabel(String caseLabel) {
        this.caseLabel = caseLabel;
        return this;
    }

    public SessionDocTestBuilder withNavigatorId(String navigatorId) {
        this.navigatorId = navigatorId;
        return this;
    }

    public SessionDocTestBuilder withOverallFieldAuthenticity(Integer score) {
        this.overallFieldAuthenticity = score;
        return this;
    }

    public SessionDocTestBuilder completed() {
        this.status = SessionStatus.COMPLETED;
        this.completedAt = Instant.parse("2025-02-01T10:00:00Z");
        return this;
    }

    public EvaluationSessionDoc build() {
        return EvaluationSessionDoc.builder()
                .id(id)
                .caseId(caseId)
                .caseLabel(caseLabel)
                .navigatorId(navigatorId)
                .navigatorName(navigatorName)
                .status(status)
                .overallFieldAuthenticity(overallFieldAuthenticity)
                .createdAt(Instant.parse("2025-02-01T09:00:00Z"))
                .completedAt(completedAt)
                .lastActivityAt(Instant.parse("2025-02-01T09:00:00Z"))
                .build();
    }
}
