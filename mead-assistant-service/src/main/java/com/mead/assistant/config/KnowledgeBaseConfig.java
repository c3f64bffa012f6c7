package com.mead.assistant.config;

import com.mead.assistant.knowledge.KnowledgeBase;
import com.mead.assistant.repository.KnowledgeBaseRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KnowledgeBaseConfig {

    // Loaded once; every engine component shares this immutable instance.
    @Bean
    public KnowledgeBase knowledgeBase(KnowledgeBaseRepository repository) {
        return repository.load();
    }
}
