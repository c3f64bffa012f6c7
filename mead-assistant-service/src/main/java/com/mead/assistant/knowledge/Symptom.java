package com.mead.assistant.knowledge;

import lombok.Builder;

import java.util.List;

@Builder
public record Symptom(
        String identifier,
        String name,
        List<String> possibleConditions,
        List<String> severityIndicators,
        List<String> seekHelp,
        List<String> selfCare
) implements KnowledgeEntity {

    public Symptom {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Symptom identifier is required");
        }
        name = Defaults.text(name);
        possibleConditions = Defaults.list(possibleConditions);
        severityIndicators = Defaults.list(severityIndicators);
        seekHelp = Defaults.list(seekHelp);
        selfCare = Defaults.list(selfCare);
    }
}
