package com.mead.assistant.knowledge;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Severity {

    CRITICAL("Critical"),
    HIGH("High"),
    MODERATE("Moderate"),
    LOW("Low"),
    INFO("Info");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Severity fromLabel(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + label));
    }
}
