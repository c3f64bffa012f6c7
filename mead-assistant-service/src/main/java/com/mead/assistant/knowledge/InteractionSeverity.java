package com.mead.assistant.knowledge;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum InteractionSeverity {

    CONTRAINDICATED("Contraindicated"),
    MAJOR("Major"),
    MODERATE("Moderate"),
    MINOR("Minor");

    private final String label;

    InteractionSeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static InteractionSeverity fromLabel(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown interaction severity: " + label));
    }
}
