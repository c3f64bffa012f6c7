package com.mead.assistant.search;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Narrows which collections a search scores. GENERAL, the default, scores all of them; the
 * other types skip every collection they do not include.
 */
public enum SearchType {

    GENERAL(EnumSet.allOf(EntityType.class)),
    SYMPTOM_CHECKER(EnumSet.of(EntityType.CONDITION, EntityType.SYMPTOM)),
    DRUG_INFORMATION(EnumSet.of(EntityType.DRUG)),
    TREATMENT_OPTIONS(EnumSet.of(EntityType.CONDITION, EntityType.DRUG)),
    PREVENTION_GUIDELINES(EnumSet.of(EntityType.CONDITION));

    private final Set<EntityType> entityTypes;

    SearchType(Set<EntityType> entityTypes) {
        this.entityTypes = entityTypes;
    }

    public boolean includes(EntityType type) {
        return entityTypes.contains(type);
    }

    /**
     * Accepts enum names as well as UI labels such as "Symptom Checker" or "drug-information".
     * Blank input means GENERAL.
     */
    public static SearchType parse(String value) {
        if (value == null || value.isBlank()) return GENERAL;
        String normalized = value.trim().replaceAll("[\\s-]+", "_");
        if ("GENERAL_SEARCH".equalsIgnoreCase(normalized)) return GENERAL;
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown search type: " + value));
    }
}
