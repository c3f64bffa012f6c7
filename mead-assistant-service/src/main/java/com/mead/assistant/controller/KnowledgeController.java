package com.mead.assistant.controller;

import com.mead.assistant.dto.AssistantDto.EntitySummary;
import com.mead.assistant.dto.AssistantDto.KnowledgeStats;
import com.mead.assistant.knowledge.Condition;
import com.mead.assistant.knowledge.Drug;
import com.mead.assistant.knowledge.Symptom;
import com.mead.assistant.service.AssistantService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class KnowledgeController {

    private final AssistantService service;

    public KnowledgeController(AssistantService service) {
        this.service = service;
    }

    @GetMapping("/knowledge/stats")
    public KnowledgeStats stats() {
        return service.stats();
    }

    @GetMapping("/conditions")
    public List<EntitySummary> listConditions() {
        return service.listConditions();
    }

    @GetMapping("/conditions/{id}")
    public Condition getCondition(@PathVariable("id") String id) {
        return service.getCondition(id);
    }

    @GetMapping("/drugs/{id}")
    public Drug getDrug(@PathVariable("id") String id) {
        return service.getDrug(id);
    }

    @GetMapping("/symptoms/{id}")
    public Symptom getSymptom(@PathVariable("id") String id) {
        return service.getSymptom(id);
    }
}
