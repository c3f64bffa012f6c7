package com.mead.assistant.dto;

import com.mead.assistant.knowledge.PatientContext;

import java.util.List;

public final class AssistantDto {

    public record AskRequest(
            String query,
            String searchType,
            PatientContext patient
    ) {}

    public record InteractionRequest(
            List<String> medications
    ) {}

    public record KnowledgeStats(
            int conditions,
            int drugs,
            int symptoms,
            int emergencyConditions,
            int interactions
    ) {}

    public record EntitySummary(
            String id,
            String name,
            String type
    ) {}

    private AssistantDto() {}
}
