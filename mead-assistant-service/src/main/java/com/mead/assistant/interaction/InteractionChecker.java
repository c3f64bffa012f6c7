package com.mead.assistant.interaction;

import com.mead.assistant.knowledge.Drug;
import com.mead.assistant.knowledge.InteractionRecord;
import com.mead.assistant.knowledge.KnowledgeBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Looks up documented interactions for a list of medication names.
 * <p>
 * Matching is lenient: names are compared case-insensitively by containment in
 * either direction, so "warfarin sodium 5mg" matches "Warfarin" and "Aspirin" matches "aspirin
 * 81". An interaction partner that names a drug class ("NSAIDs") is also matched by any member
 * of that class and by any known drug whose class it names.
 * <p>
 * Each record is reported at most once, in interaction table order, however many medications
 * trigger it.
 */
@Component
public class InteractionChecker {

    private static final Logger log = LoggerFactory.getLogger(InteractionChecker.class);

    private final KnowledgeBase knowledgeBase;

    public InteractionChecker(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    public List<InteractionRecord> checkInteractions(List<String> medicationNames) {
        if (medicationNames == null) {
            throw new IllegalArgumentException("Medication list must not be null");
        }
        List<String> medications = medicationNames.stream()
                .filter(Objects::nonNull)
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .filter(name -> !name.isEmpty())
                .toList();
        if (medications.isEmpty()) return List.of();

        Set<InteractionRecord> found = new LinkedHashSet<>();
        for (Map.Entry<String, List<InteractionRecord>> entry : knowledgeBase.getInteractionTable().entrySet()) {
            if (!anyMatches(medications, List.of(entry.getKey()))) continue;
            for (InteractionRecord record : entry.getValue()) {
                if (anyMatches(medications, partnerNames(record.partnerDrug()))) {
                    found.add(record);
                }
            }
        }

        if (!found.isEmpty()) {
            log.debug("Found {} interaction(s) for {} medication(s)", found.size(), medications.size());
        }
        return List.copyOf(found);
    }

    /**
     * The partner itself plus every name that stands for it: members of the drug class it names
     * and known drugs whose class it names.
     */
    private List<String> partnerNames(String partner) {
        List<String> names = new ArrayList<>();
        names.add(partner);
        String partnerLower = partner.toLowerCase(Locale.ROOT);

        knowledgeBase.getDrugClasses().forEach((className, members) -> {
            if (containsEitherWay(className.toLowerCase(Locale.ROOT), partnerLower)) {
                names.addAll(members);
            }
        });
        for (Drug drug : knowledgeBase.getDrugs().values()) {
            String drugClass = drug.drugClass().toLowerCase(Locale.ROOT);
            if (!drugClass.isEmpty() && containsEitherWay(drugClass, partnerLower)) {
                names.add(drug.name());
                names.add(drug.genericName());
            }
        }
        return names;
    }

    private static boolean anyMatches(List<String> medications, List<String> candidateNames) {
        for (String candidate : candidateNames) {
            if (candidate == null || candidate.isBlank()) continue;
            String name = candidate.toLowerCase(Locale.ROOT);
            for (String medication : medications) {
                if (containsEitherWay(medication, name)) return true;
            }
        }
        return false;
    }

    private static boolean containsEitherWay(String a, String b) {
        return a.contains(b) || b.contains(a);
    }
}
