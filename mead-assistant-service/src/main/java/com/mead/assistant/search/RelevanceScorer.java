package com.mead.assistant.search;

import com.mead.assistant.knowledge.Condition;
import com.mead.assistant.knowledge.Drug;
import com.mead.assistant.knowledge.Symptom;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical relevance scoring. A field matches when any query token occurs as a substring of the
 * lower-cased field text; there is no stemming, stop-word removal or fuzzy matching.
 */
@Component
public class RelevanceScorer {

    static final double NAME_WEIGHT = 10;
    static final double GENERIC_NAME_WEIGHT = 8;
    static final double CONDITION_SYMPTOM_WEIGHT = 3;
    static final double TREATMENT_WEIGHT = 2;
    static final double CAUSE_WEIGHT = 1;
    static final double INDICATION_WEIGHT = 3;
    static final double POSSIBLE_CONDITION_WEIGHT = 2;

    /**
     * Lower-cases the query and splits it on Unicode whitespace, so a pasted non-breaking space
     * separates tokens too. Duplicate tokens collapse.
     */
    public static Set<String> tokenize(String query) {
        Set<String> tokens = new LinkedHashSet<>();
        if (query == null) return tokens;
        for (String token : query.toLowerCase(Locale.ROOT).split("(?U)\\s+")) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }

    public double score(Set<String> tokens, Condition condition) {
        if (tokens.isEmpty()) return 0;
        double score = 0;
        if (matches(tokens, condition.name())) score += NAME_WEIGHT;
        score += CONDITION_SYMPTOM_WEIGHT * countMatches(tokens, condition.symptoms());
        score += TREATMENT_WEIGHT * countMatches(tokens, condition.treatments());
        score += CAUSE_WEIGHT * countMatches(tokens, condition.causes());
        return score;
    }

    public double score(Set<String> tokens, Drug drug) {
        if (tokens.isEmpty()) return 0;
        double score = 0;
        if (matches(tokens, drug.name())) score += NAME_WEIGHT;
        if (matches(tokens, drug.genericName())) score += GENERIC_NAME_WEIGHT;
        score += INDICATION_WEIGHT * countMatches(tokens, drug.indications());
        return score;
    }

    public double score(Set<String> tokens, Symptom symptom) {
        if (tokens.isEmpty()) return 0;
        double score = 0;
        if (matches(tokens, symptom.name())) score += NAME_WEIGHT;
        score += POSSIBLE_CONDITION_WEIGHT * countMatches(tokens, symptom.possibleConditions());
        return score;
    }

    static boolean matches(Collection<String> tokens, String fieldText) {
        if (fieldText == null || fieldText.isEmpty()) return false;
        String haystack = fieldText.toLowerCase(Locale.ROOT);
        for (String token : tokens) {
            if (haystack.contains(token)) return true;
        }
        return false;
    }

    private static long countMatches(Collection<String> tokens, List<String> phrases) {
        return phrases.stream()
                .filter(phrase -> matches(tokens, phrase))
                .count();
    }
}
