package com.example.annotation.evaluation.model.request;

/**
 * Optional body for completion; a score given here is written with the status change.
 */
public record CompleteSessionRequest(
        Integer overallFieldAuthenticity
) {}
