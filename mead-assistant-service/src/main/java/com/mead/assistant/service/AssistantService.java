package com.mead.assistant.service;

import com.mead.assistant.dto.AssistantDto.EntitySummary;
import com.mead.assistant.dto.AssistantDto.KnowledgeStats;
import com.mead.assistant.exception.UnknownEntityException;
import com.mead.assistant.interaction.InteractionChecker;
import com.mead.assistant.knowledge.Condition;
import com.mead.assistant.knowledge.Drug;
import com.mead.assistant.knowledge.InteractionRecord;
import com.mead.assistant.knowledge.KnowledgeBase;
import com.mead.assistant.knowledge.PatientContext;
import com.mead.assistant.knowledge.Symptom;
import com.mead.assistant.response.ResponseBundle;
import com.mead.assistant.response.ResponseComposer;
import com.mead.assistant.search.EntityType;
import com.mead.assistant.search.SearchEngine;
import com.mead.assistant.search.SearchResult;
import com.mead.assistant.search.SearchType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point used by the HTTP layer: validates input, then runs search and composition.
 */
@Service
public class AssistantService {

    private static final Logger log = LoggerFactory.getLogger(AssistantService.class);

    private final KnowledgeBase knowledgeBase;
    private final SearchEngine searchEngine;
    private final InteractionChecker interactionChecker;
    private final ResponseComposer responseComposer;

    public AssistantService(KnowledgeBase knowledgeBase,
                            SearchEngine searchEngine,
                            InteractionChecker interactionChecker,
                            ResponseComposer responseComposer) {
        this.knowledgeBase = knowledgeBase;
        this.searchEngine = searchEngine;
        this.interactionChecker = interactionChecker;
        this.responseComposer = responseComposer;
    }

    public ResponseBundle ask(String query, String searchType, PatientContext patient) {
        validateQuery(query);
        List<SearchResult> results = searchEngine.search(query, SearchType.parse(searchType));
        ResponseBundle bundle = responseComposer.compose(query, results, patient);
        log.info("Answered query with {} result(s), emergency={}", results.size(), bundle.isEmergency());
        return bundle;
    }

    public List<SearchResult> search(String query, String searchType) {
        validateQuery(query);
        return searchEngine.search(query, SearchType.parse(searchType));
    }

    public List<InteractionRecord> checkInteractions(List<String> medications) {
        if (medications == null) {
            throw new IllegalArgumentException("medications is required");
        }
        return interactionChecker.checkInteractions(medications);
    }

    public KnowledgeStats stats() {
        return new KnowledgeStats(
                knowledgeBase.getConditions().size(),
                knowledgeBase.getDrugs().size(),
                knowledgeBase.getSymptoms().size(),
                knowledgeBase.getEmergencyConditionNames().size(),
                knowledgeBase.interactionCount()
        );
    }

    public List<EntitySummary> listConditions() {
        return knowledgeBase.getConditions().values().stream()
                .map(c -> new EntitySummary(c.identifier(), c.name(), EntityType.CONDITION.tag()))
                .toList();
    }

    public Condition getCondition(String conditionId) {
        return knowledgeBase.findCondition(conditionId)
                .orElseThrow(() -> new UnknownEntityException("condition", conditionId));
    }

    public Drug getDrug(String drugId) {
        return knowledgeBase.findDrug(drugId)
                .orElseThrow(() -> new UnknownEntityException("drug", drugId));
    }

    public Symptom getSymptom(String symptomId) {
        return knowledgeBase.findSymptom(symptomId)
                .orElseThrow(() -> new UnknownEntityException("symptom", symptomId));
    }

    private static void validateQuery(String query) {
        if (query == null) {
            throw new IllegalArgumentException("query is required");
        }
    }
}
