package com.example.annotation.cases.model.response;

import java.util.List;

public record ImportCasesResponse(
        String batchId,
        int imported,
        List<String> caseIds
) {}
