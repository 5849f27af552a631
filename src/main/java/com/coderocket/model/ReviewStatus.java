package com.coderocket.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall outcome of a review request.
 */
public enum ReviewStatus {
    SUCCESS("✅"),
    WARNING("⚠️"),
    FAILED("❌"),
    NOTHING_TO_REVIEW("📝");

    private final String symbol;

    ReviewStatus(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }
}
