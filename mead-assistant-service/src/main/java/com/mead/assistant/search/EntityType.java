package com.mead.assistant.search;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityType {

    CONDITION,
    DRUG,
    SYMPTOM;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
