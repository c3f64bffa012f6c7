package com.mead.assistant.knowledge;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Strength of the evidence behind a condition entry.
 */
public enum EvidenceLevel {

    LEVEL_1A("1A", "Systematic Review of RCTs"),
    LEVEL_1B("1B", "Individual RCT"),
    LEVEL_2A("2A", "Systematic Review of Cohort Studies"),
    LEVEL_2B("2B", "Individual Cohort Study"),
    LEVEL_3("3", "Case-Control Studies"),
    EXPERT_OPINION("Expert", "Expert Opinion");

    private final String code;
    private final String description;

    EvidenceLevel(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    @JsonValue
    public String label() {
        return this == EXPERT_OPINION ? description : code + " - " + description;
    }

    public static EvidenceLevel fromCode(String code) {
        if (code == null || code.isBlank()) return EXPERT_OPINION;
        return Arrays.stream(values())
                .filter(level -> level.code.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown evidence level: " + code));
    }
}
