package com.coderocket.model;

import java.time.Instant;

/**
 * Result of any review request. {@code aiServiceUsed} is the backend that actually
 * produced the review, which can differ from the one requested.
 */
public record ReviewResponse(
        ReviewStatus status,
        String summary,
        String review,
        String aiServiceUsed,
        Instant timestamp
) {
}
