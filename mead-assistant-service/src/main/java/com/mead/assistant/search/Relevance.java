package com.mead.assistant.search;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse relevance bucket derived from a score.
 */
public enum Relevance {

    HIGH,
    MEDIUM,
    LOW;

    static final double HIGH_THRESHOLD = 8;
    static final double MEDIUM_THRESHOLD = 4;

    public static Relevance fromScore(double score) {
        if (score >= HIGH_THRESHOLD) return HIGH;
        if (score >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
