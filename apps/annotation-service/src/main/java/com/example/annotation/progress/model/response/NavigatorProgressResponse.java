package com.example.annotation.progress.model.response;

/**
 * Per-navigator counts against the whole catalog.
 * {@code remaining = totalCases - completed - inProgress}.
 */
public record NavigatorProgressResponse(
        String navigatorId,
        String navigatorName,
        long completed,
        long inProgress,
        long remaining,
        long totalCases
) {}
