package com.mead.assistant.knowledge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, pre-loaded medical knowledge: conditions, drugs and symptoms keyed by identifier,
 * the emergency condition names, the interaction table keyed by primary drug name and the
 * drug-class membership table.
 * <p>
 * Every map keeps insertion order; the search engine relies on it to break score ties.
 */
public final class KnowledgeBase {

    private final Map<String, Condition> conditions;
    private final Map<String, Drug> drugs;
    private final Map<String, Symptom> symptoms;
    private final List<String> emergencyConditionNames;
    private final Map<String, List<InteractionRecord>> interactionTable;
    private final Map<String, List<String>> drugClasses;

    private KnowledgeBase(Builder builder) {
        this.conditions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.conditions));
        this.drugs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.drugs));
        this.symptoms = Collections.unmodifiableMap(new LinkedHashMap<>(builder.symptoms));
        this.emergencyConditionNames = List.copyOf(builder.emergencyConditionNames);

        Map<String, List<InteractionRecord>> table = new LinkedHashMap<>();
        builder.interactionTable.forEach((primary, records) -> table.put(primary, List.copyOf(records)));
        this.interactionTable = Collections.unmodifiableMap(table);

        Map<String, List<String>> classes = new LinkedHashMap<>();
        builder.drugClasses.forEach((name, members) -> classes.put(name, List.copyOf(members)));
        this.drugClasses = Collections.unmodifiableMap(classes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static KnowledgeBase empty() {
        return builder().build();
    }

    public Map<String, Condition> getConditions() {
        return conditions;
    }

    public Map<String, Drug> getDrugs() {
        return drugs;
    }

    public Map<String, Symptom> getSymptoms() {
        return symptoms;
    }

    public List<String> getEmergencyConditionNames() {
        return emergencyConditionNames;
    }

    public Map<String, List<InteractionRecord>> getInteractionTable() {
        return interactionTable;
    }

    /**
     * Drug class name (as used by interaction partners, e.g. "NSAIDs") to member drug names.
     */
    public Map<String, List<String>> getDrugClasses() {
        return drugClasses;
    }

    public Optional<Condition> findCondition(String id) {
        return Optional.ofNullable(conditions.get(id));
    }

    public Optional<Drug> findDrug(String id) {
        return Optional.ofNullable(drugs.get(id));
    }

    public Optional<Symptom> findSymptom(String id) {
        return Optional.ofNullable(symptoms.get(id));
    }

    public int interactionCount() {
        return interactionTable.values().stream().mapToInt(List::size).sum();
    }

    public static final class Builder {

        private final Map<String, Condition> conditions = new LinkedHashMap<>();
        private final Map<String, Drug> drugs = new LinkedHashMap<>();
        private final Map<String, Symptom> symptoms = new LinkedHashMap<>();
        private final List<String> emergencyConditionNames = new ArrayList<>();
        private final Map<String, List<InteractionRecord>> interactionTable = new LinkedHashMap<>();
        private final Map<String, List<String>> drugClasses = new LinkedHashMap<>();

        private Builder() {}

        public Builder condition(Condition condition) {
            putUnique(conditions, condition.identifier(), condition, "condition");
            return this;
        }

        public Builder drug(Drug drug) {
            putUnique(drugs, drug.identifier(), drug, "drug");
            return this;
        }

        public Builder symptom(Symptom symptom) {
            putUnique(symptoms, symptom.identifier(), symptom, "symptom");
            return this;
        }

        public Builder emergencyConditionNames(List<String> names) {
            if (names != null) emergencyConditionNames.addAll(names);
            return this;
        }

        public Builder interaction(InteractionRecord record) {
            interactionTable.computeIfAbsent(record.primaryDrug(), k -> new ArrayList<>()).add(record);
            return this;
        }

        public Builder drugClass(String className, List<String> members) {
            if (className == null || className.isBlank()) {
                throw new IllegalArgumentException("Drug class name is required");
            }
            drugClasses.computeIfAbsent(className, k -> new ArrayList<>())
                    .addAll(members == null ? List.of() : members);
            return this;
        }

        public KnowledgeBase build() {
            return new KnowledgeBase(this);
        }

        private static <T> void putUnique(Map<String, T> target, String id, T value, String kind) {
            if (target.putIfAbsent(id, value) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " identifier: " + id);
            }
        }
    }
}
