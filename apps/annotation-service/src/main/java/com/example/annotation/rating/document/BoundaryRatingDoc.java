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
 * Format 3: the navigator's category for one RL-scenario option next to the
 * category the generator intended.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "eval_format_3_boundaries")
@CompoundIndex(name = "session_option_uq", def = "{'sessionId': 1, 'optionIndex': 1}", unique = true)
public class BoundaryRatingDoc {

    @Id
    private String id;

    private String sessionId;

    private int optionIndex;

    private String pnCategory;

    private String aiIntendedCategory;

    private Instant submittedAt;
}
