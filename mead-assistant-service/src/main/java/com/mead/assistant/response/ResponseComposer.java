package com.mead.assistant.response;

import com.mead.assistant.interaction.InteractionChecker;
import com.mead.assistant.knowledge.Condition;
import com.mead.assistant.knowledge.Drug;
import com.mead.assistant.knowledge.InteractionRecord;
import com.mead.assistant.knowledge.PatientContext;
import com.mead.assistant.knowledge.Symptom;
import com.mead.assistant.search.EntityType;
import com.mead.assistant.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns ranked search results into a {@link ResponseBundle}.
 */
@Component
public class ResponseComposer {

    private static final Logger log = LoggerFactory.getLogger(ResponseComposer.class);

    static final int PRIMARY_COUNT = 5;
    static final int SECONDARY_COUNT = 5;
    static final int RELATED_WINDOW = 3;
    static final int MAX_RELATED = 6;
    static final int RECOMMENDATION_CONDITIONS = 2;
    static final int MAX_RECOMMENDATIONS = 8;
    static final int SEEK_HELP_SYMPTOMS = 2;
    static final int MAX_SEEK_HELP = 6;
    static final int ITEMS_PER_ENTITY = 2;
    static final int MAX_SOURCES = 5;

    public static final String DISCLAIMER = """
            IMPORTANT MEDICAL DISCLAIMER: This information is for educational purposes only and is \
            not intended to replace professional medical advice, diagnosis, or treatment. Always seek \
            the advice of your physician or other qualified health provider with any questions you may \
            have regarding a medical condition. Never disregard professional medical advice or delay in \
            seeking it because of something you have read here.""";

    static final String NO_RESULTS_MESSAGE = "I couldn't find specific information about your query. "
            + "Please try rephrasing your question or consult with a healthcare professional.";

    static final List<String> REPHRASE_SUGGESTIONS = List.of(
            "Try using different medical terms",
            "Be more specific about symptoms",
            "Check spelling of medical terms",
            "Consult with a healthcare provider"
    );

    static final List<String> EMERGENCY_KEYWORDS = List.of(
            "chest pain", "heart attack", "stroke", "difficulty breathing",
            "severe headache", "confusion", "unconscious", "bleeding",
            "severe pain", "emergency", "urgent"
    );

    static final String EMERGENCY_MESSAGE = "MEDICAL EMERGENCY - If you are experiencing a medical emergency, "
            + "call 911 immediately or go to the nearest emergency room.";

    static final List<String> EMERGENCY_CONTACTS = List.of(
            "911", "Emergency Room", "Poison Control: 1-800-222-1222"
    );

    static final List<String> GENERAL_RECOMMENDATIONS = List.of(
            "Maintain a healthy lifestyle with regular exercise and balanced diet",
            "Follow up with your healthcare provider for proper diagnosis and treatment",
            "Keep track of your symptoms and their patterns",
            "Take medications as prescribed by your doctor"
    );

    static final List<String> GENERAL_SEEK_HELP = List.of(
            "Seek immediate medical attention if symptoms are severe or worsening",
            "Contact your healthcare provider if symptoms persist or interfere with daily activities",
            "Go to emergency room for life-threatening symptoms"
    );

    static final List<String> EVIDENCE_SOURCES = List.of(
            "American Medical Association (AMA)",
            "Centers for Disease Control and Prevention (CDC)",
            "World Health Organization (WHO)",
            "National Institutes of Health (NIH)",
            "Mayo Clinic",
            "Cleveland Clinic",
            "Johns Hopkins Medicine",
            "American Heart Association (AHA)",
            "American Diabetes Association (ADA)",
            "Medical Literature and Clinical Guidelines"
    );

    private final InteractionChecker interactionChecker;

    public ResponseComposer(InteractionChecker interactionChecker) {
        this.interactionChecker = interactionChecker;
    }

    public ResponseBundle compose(String query, List<SearchResult> results) {
        return compose(query, results, null);
    }

    public ResponseBundle compose(String query, List<SearchResult> results, PatientContext patientContext) {
        if (query == null) {
            throw new IllegalArgumentException("Query must not be null");
        }
        if (results == null) {
            throw new IllegalArgumentException("Search results must not be null");
        }
        if (results.isEmpty()) {
            return noResults(query);
        }

        List<SearchResult> primary = slice(results, 0, PRIMARY_COUNT);
        List<SearchResult> secondary = slice(results, PRIMARY_COUNT, PRIMARY_COUNT + SECONDARY_COUNT);

        return new ResponseBundle(
                query,
                null,
                null,
                detectEmergency(query),
                primary,
                secondary,
                relatedInformation(results),
                recommendations(results),
                seekHelpAdvice(results),
                interactionWarnings(primary, secondary, patientContext),
                DISCLAIMER,
                EVIDENCE_SOURCES.subList(0, MAX_SOURCES)
        );
    }

    /**
     * Inspects only the raw query text; the matched entities play no part.
     */
    EmergencyAlert detectEmergency(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        List<String> matched = EMERGENCY_KEYWORDS.stream()
                .filter(lower::contains)
                .toList();
        if (matched.isEmpty()) return null;

        log.warn("Emergency keywords {} detected in query", matched);
        return new EmergencyAlert(EMERGENCY_MESSAGE, EMERGENCY_CONTACTS, matched);
    }

    private ResponseBundle noResults(String query) {
        return new ResponseBundle(
                query,
                NO_RESULTS_MESSAGE,
                REPHRASE_SUGGESTIONS,
                null,
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                DISCLAIMER,
                List.of()
        );
    }

    private static List<String> relatedInformation(List<SearchResult> results) {
        List<String> related = new ArrayList<>();
        List<SearchResult> window = results.subList(0, Math.min(RELATED_WINDOW, results.size()));
        for (Condition condition : entitiesOfType(window, EntityType.CONDITION, Condition.class, RELATED_WINDOW)) {
            first(condition.prevention()).forEach(p -> related.add("Prevention: " + p));
            first(condition.riskFactors()).forEach(r -> related.add("Risk factor: " + r));
        }
        return limit(related, MAX_RELATED);
    }

    private static List<String> recommendations(List<SearchResult> results) {
        List<String> recommendations = new ArrayList<>(GENERAL_RECOMMENDATIONS);
        for (Condition condition : entitiesOfType(results, EntityType.CONDITION, Condition.class, RECOMMENDATION_CONDITIONS)) {
            recommendations.addAll(first(condition.prevention()));
        }
        return limit(recommendations, MAX_RECOMMENDATIONS);
    }

    private static List<String> seekHelpAdvice(List<SearchResult> results) {
        Set<String> advice = new LinkedHashSet<>(GENERAL_SEEK_HELP);
        for (Symptom symptom : entitiesOfType(results, EntityType.SYMPTOM, Symptom.class, SEEK_HELP_SYMPTOMS)) {
            advice.addAll(first(symptom.seekHelp()));
        }
        return limit(new ArrayList<>(advice), MAX_SEEK_HELP);
    }

    /**
     * Checks the patient's medications together with the drugs shown in the response.
     */
    private List<InteractionRecord> interactionWarnings(List<SearchResult> primary,
                                                        List<SearchResult> secondary,
                                                        PatientContext patientContext) {
        if (patientContext == null || !patientContext.hasMedications()) return List.of();

        List<SearchResult> shown = Stream.concat(primary.stream(), secondary.stream()).toList();
        List<String> medications = new ArrayList<>(patientContext.medications());
        entitiesOfType(shown, EntityType.DRUG, Drug.class, shown.size())
                .forEach(drug -> medications.add(drug.name()));
        return interactionChecker.checkInteractions(medications);
    }

    private static <T> List<T> entitiesOfType(List<SearchResult> results, EntityType type, Class<T> entityClass, int max) {
        return results.stream()
                .filter(result -> result.is(type) && entityClass.isInstance(result.entity()))
                .map(result -> entityClass.cast(result.entity()))
                .limit(max)
                .toList();
    }

    private static List<String> first(List<String> values) {
        if (values == null || values.isEmpty()) return List.of();
        return values.subList(0, Math.min(ITEMS_PER_ENTITY, values.size()));
    }

    private static <T> List<T> slice(List<T> values, int from, int to) {
        if (from >= values.size()) return List.of();
        return List.copyOf(values.subList(from, Math.min(to, values.size())));
    }

    private static List<String> limit(List<String> values, int max) {
        if (values.size() <= max) return List.copyOf(values);
        return List.copyOf(values.subList(0, max));
    }
}
