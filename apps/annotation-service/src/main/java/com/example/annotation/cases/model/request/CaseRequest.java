package com.example.annotation.cases.model.request;

import jakarta.validation.constraints.Size;

/**
 * A case as authored by an administrator. Payloads are opaque JSON trees.
 */
public record CaseRequest(
        @Size(max = 128) String batchId,
        @Size(max = 200) String label,
        String narrativeSummary,
        Object format1StateLog,
        Object format2Triples,
        Object format3RlScenario
) {}
