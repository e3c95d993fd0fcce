package com.example.annotation.evaluation.model.request;

import jakarta.validation.constraints.NotBlank;

/**
 * @param caseId      the case to evaluate
 * @param navigatorId the navigator the session is for; defaults to the caller
 */
public record StartSessionRequest(
        @NotBlank String caseId,
        String navigatorId
) {}
