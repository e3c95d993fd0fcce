package com.example.annotation.evaluation.document;

import com.example.annotation.evaluation.model.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for one navigator's evaluation of one case.
 *
 * <p>The unique {@code case_navigator_uq} index is what makes concurrent starts
 * for the same pair resolve to a single session. Status changes only through
 * the conditional updates in the repository, which keep {@code completedAt}
 * set exactly when the status is {@code COMPLETED}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "evaluation_sessions")
@CompoundIndexes({
        @CompoundIndex(name = "case_navigator_uq", def = "{'caseId': 1, 'navigatorId': 1}", unique = true),
        @CompoundIndex(name = "navigator_status_idx", def = "{'navigatorId': 1, 'status': 1}")
})
public class EvaluationSessionDoc {

    @Id
    private String id;

    private String caseId;

    /**
     * Copied from the case at start so lists render without a join.
     */
    private String caseLabel;

    private String navigatorId;

    private String navigatorName;

    private SessionStatus status;

    /**
     * 1..5, null until submitted.
     */
    private Integer overallFieldAuthenticity;

    @CreatedDate
    private Instant createdAt;

    private Instant completedAt;

    private Instant lastActivityAt;

    /**
     * Bumped by every write against the session, including rating writes.
     */
    private long revision;
}
