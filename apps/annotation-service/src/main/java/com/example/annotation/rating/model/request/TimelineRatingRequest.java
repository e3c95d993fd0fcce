package com.example.annotation.rating.model.request;

import jakarta.validation.constraints.NotNull;

/**
 * Free-text classifications are stored verbatim; only presence is checked.
 */
public record TimelineRatingRequest(
        @NotNull String clinicalImpact,
        @NotNull String environmentalImpact,
        @NotNull String homeServiceAdoptionImpact,
        @NotNull String eddDelta,
        @NotNull Boolean bottleneckRealism
) {}
