package com.mead.assistant.knowledge;

/**
 * Common view over the three knowledge collections: conditions, drugs and symptoms.
 */
public interface KnowledgeEntity {

    String identifier();

    String name();
}
