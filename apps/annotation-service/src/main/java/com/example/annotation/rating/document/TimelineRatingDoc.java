package com.example.annotation.rating.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Format 1: rating of one event in the case's state log.
 * Owned by its session; the navigator is resolved through the session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "eval_format_1_timeline")
@CompoundIndex(name = "session_event_uq", def = "{'sessionId': 1, 'eventIndex': 1}", unique = true)
public class TimelineRatingDoc {

    /**
     * {@code <sessionId>:<eventIndex>}
     */
    @Id
    private String id;

    private String sessionId;

    private int eventIndex;

    private String clinicalImpact;

    private String environmentalImpact;

    private String homeServiceAdoptionImpact;

    private String eddDelta;

    private boolean bottleneckRealism;

    private Instant submittedAt;
}
