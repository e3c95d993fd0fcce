package com.example.annotation.rating.model.request;

import jakarta.validation.constraints.NotNull;

public record BoundaryRatingRequest(
        @NotNull String pnCategory,
        @NotNull String aiIntendedCategory
) {}
