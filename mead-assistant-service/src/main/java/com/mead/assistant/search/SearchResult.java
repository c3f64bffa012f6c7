package com.mead.assistant.search;

import com.mead.assistant.knowledge.KnowledgeEntity;

/**
 * One ranked match produced by {@link SearchEngine}; lives only for the duration of a request.
 *
 * @param type      which collection the entity came from
 * @param id        the entity identifier within its collection
 * @param entity    the matched condition, drug or symptom
 * @param score     the lexical relevance score, always positive
 * @param relevance bucket derived from {@code score}
 */
public record SearchResult(
        EntityType type,
        String id,
        KnowledgeEntity entity,
        double score,
        Relevance relevance
) {

    public static SearchResult of(EntityType type, KnowledgeEntity entity, double score) {
        return new SearchResult(type, entity.identifier(), entity, score, Relevance.fromScore(score));
    }

    public boolean is(EntityType expected) {
        return type == expected;
    }
}
