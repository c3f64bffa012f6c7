package com.mead.assistant.knowledge;

import lombok.Builder;

import java.util.List;

@Builder
public record Condition(
        String identifier,
        String name,
        String classificationCode,
        List<String> symptoms,
        List<String> causes,
        List<String> treatments,
        List<String> complications,
        List<String> prevention,
        List<String> riskFactors,
        List<String> diagnosticTests,
        Severity severity,
        String prevalence,
        List<String> ageGroups,
        List<String> specialties,
        EvidenceLevel evidenceLevel
) implements KnowledgeEntity {

    public Condition {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Condition identifier is required");
        }
        name = Defaults.text(name);
        classificationCode = Defaults.text(classificationCode);
        symptoms = Defaults.list(symptoms);
        causes = Defaults.list(causes);
        treatments = Defaults.list(treatments);
        complications = Defaults.list(complications);
        prevention = Defaults.list(prevention);
        riskFactors = Defaults.list(riskFactors);
        diagnosticTests = Defaults.list(diagnosticTests);
        severity = severity == null ? Severity.INFO : severity;
        prevalence = Defaults.text(prevalence);
        ageGroups = Defaults.list(ageGroups);
        specialties = Defaults.list(specialties);
        evidenceLevel = evidenceLevel == null ? EvidenceLevel.EXPERT_OPINION : evidenceLevel;
    }
}
