package com.example.annotation.rating.model.request;

public record TacticRatingRequest(
        Integer intentFeasibilityScore
) {}
