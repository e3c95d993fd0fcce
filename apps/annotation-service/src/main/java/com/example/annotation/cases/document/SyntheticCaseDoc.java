package com.example.annotation.cases.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for a synthetic case.
 * The three format payloads are arbitrary JSON trees, stored and returned verbatim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "synthetic_cases")
public class SyntheticCaseDoc {

    @Id
    private String id;

    @Indexed
    private String batchId;

    private String label;

    private String narrativeSummary;

    private Object format1StateLog;

    private Object format2Triples;

    private Object format3RlScenario;

    // Bumped when a session is started against this document
    private long revision;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
