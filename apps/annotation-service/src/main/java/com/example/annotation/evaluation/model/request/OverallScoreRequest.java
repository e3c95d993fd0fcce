package com.example.annotation.evaluation.model.request;

/**
 * Range is checked by the session manager so that 0 and 6 surface as invalid arguments.
 */
public record OverallScoreRequest(
        Integer overallFieldAuthenticity
) {}
