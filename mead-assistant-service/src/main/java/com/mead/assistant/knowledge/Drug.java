package com.mead.assistant.knowledge;

import lombok.Builder;

import java.util.List;

@Builder
public record Drug(
        String identifier,
        String name,
        String genericName,
        String drugClass,
        List<String> indications,
        List<String> contraindications,
        List<String> sideEffects,
        List<String> interactions,
        String dosage,
        String pregnancyCategory,
        List<String> monitoring
) implements KnowledgeEntity {

    public Drug {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Drug identifier is required");
        }
        name = Defaults.text(name);
        genericName = Defaults.text(genericName);
        drugClass = Defaults.text(drugClass);
        indications = Defaults.list(indications);
        contraindications = Defaults.list(contraindications);
        sideEffects = Defaults.list(sideEffects);
        interactions = Defaults.list(interactions);
        dosage = Defaults.text(dosage);
        pregnancyCategory = Defaults.text(pregnancyCategory);
        monitoring = Defaults.list(monitoring);
    }
}
