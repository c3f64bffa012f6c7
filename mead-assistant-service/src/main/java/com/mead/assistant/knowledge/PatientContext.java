package com.mead.assistant.knowledge;

import lombok.Builder;

import java.util.List;

/**
 * Optional profile data supplied by the caller alongside a query. Never mutated by the engine.
 */
@Builder
public record PatientContext(
        Integer age,
        String gender,
        List<String> conditions,
        List<String> medications,
        List<String> allergies
) {

    public PatientContext {
        conditions = Defaults.list(conditions);
        medications = Defaults.list(medications);
        allergies = Defaults.list(allergies);
    }

    public static PatientContext empty() {
        return new PatientContext(null, null, List.of(), List.of(), List.of());
    }

    public boolean hasMedications() {
        return medications.stream().anyMatch(m -> !m.isBlank());
    }
}
