package com.mead.assistant.search;

import com.mead.assistant.knowledge.KnowledgeBase;
import com.mead.assistant.knowledge.KnowledgeEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Scores every knowledge entity against a free-text query and returns the best matches.
 * <p>
 * Ranking is a stable descending sort on score: equal scores keep conditions before drugs
 * before symptoms, then knowledge base insertion order.
 */
@Component
public class SearchEngine {

    private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

    public static final int MAX_RESULTS = 15;

    private final KnowledgeBase knowledgeBase;
    private final RelevanceScorer scorer;

    @Autowired
    public SearchEngine(KnowledgeBase knowledgeBase, RelevanceScorer scorer) {
        this.knowledgeBase = knowledgeBase;
        this.scorer = scorer;
    }

    public SearchEngine(KnowledgeBase knowledgeBase) {
        this(knowledgeBase, new RelevanceScorer());
    }

    public List<SearchResult> search(String query) {
        return search(query, SearchType.GENERAL);
    }

    public List<SearchResult> search(String query, SearchType searchType) {
        if (query == null) {
            throw new IllegalArgumentException("Query must not be null");
        }
        SearchType type = searchType == null ? SearchType.GENERAL : searchType;

        Set<String> tokens = RelevanceScorer.tokenize(query);
        if (tokens.isEmpty()) return List.of();

        List<SearchResult> results = new ArrayList<>();
        if (type.includes(EntityType.CONDITION)) {
            knowledgeBase.getConditions().values().forEach(condition ->
                    addIfRelevant(results, EntityType.CONDITION, condition, scorer.score(tokens, condition)));
        }
        if (type.includes(EntityType.DRUG)) {
            knowledgeBase.getDrugs().values().forEach(drug ->
                    addIfRelevant(results, EntityType.DRUG, drug, scorer.score(tokens, drug)));
        }
        if (type.includes(EntityType.SYMPTOM)) {
            knowledgeBase.getSymptoms().values().forEach(symptom ->
                    addIfRelevant(results, EntityType.SYMPTOM, symptom, scorer.score(tokens, symptom)));
        }

        // List.sort is stable, which keeps the tie order described above.
        results.sort(Comparator.comparingDouble(SearchResult::score).reversed());

        List<SearchResult> top = results.size() > MAX_RESULTS
                ? List.copyOf(results.subList(0, MAX_RESULTS))
                : List.copyOf(results);

        log.debug("Search type={} tokens={} matched={} returned={}",
                type, tokens.size(), results.size(), top.size());
        return top;
    }

    private static void addIfRelevant(List<SearchResult> results,
                                      EntityType type,
                                      KnowledgeEntity entity,
                                      double score) {
        if (score > 0) {
            results.add(SearchResult.of(type, entity, score));
        }
    }
}
