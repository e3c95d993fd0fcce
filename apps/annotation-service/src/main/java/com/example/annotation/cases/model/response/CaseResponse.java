package com.example.annotation.cases.model.response;

import com.example.annotation.cases.document.SyntheticCaseDoc;

import java.time.Instant;

public record CaseResponse(
        String id,
        String batchId,
        String label,
        String narrativeSummary,
        Object format1StateLog,
        Object format2Triples,
        Object format3RlScenario,
        Instant createdAt
) {
    public static CaseResponse from(SyntheticCaseDoc doc) {
        return new CaseResponse(
                doc.getId(),
                doc.getBatchId(),
                doc.getLabel(),
                doc.getNarrativeSummary(),
                doc.getFormat1StateLog(),
                doc.getFormat2Triples(),
                doc.getFormat3RlScenario(),
                doc.getCreatedAt());
    }
}
