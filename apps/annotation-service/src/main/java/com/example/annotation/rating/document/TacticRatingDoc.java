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
 * Format 2: feasibility score for one tactic triple.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "eval_format_2_tactics")
@CompoundIndex(name = "session_triple_uq", def = "{'sessionId': 1, 'tripleIndex': 1}", unique = true)
public class TacticRatingDoc {

    @Id
    private String id;

    private String sessionId;

    private int tripleIndex;

    private int intentFeasibilityScore;

    private Instant submittedAt;
}
