package com.mead.assistant.controller;

import com.mead.assistant.dto.AssistantDto.AskRequest;
import com.mead.assistant.dto.AssistantDto.InteractionRequest;
import com.mead.assistant.knowledge.InteractionRecord;
import com.mead.assistant.response.ResponseBundle;
import com.mead.assistant.search.SearchResult;
import com.mead.assistant.service.AssistantService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class AssistantController {

    private final AssistantService service;

    public AssistantController(AssistantService service) {
        this.service = service;
    }

    @PostMapping("/ask")
    public ResponseBundle ask(@RequestBody AskRequest request) {
        return service.ask(request.query(), request.searchType(), request.patient());
    }

    @GetMapping("/search")
    public List<SearchResult> search(@RequestParam("q") String query,
                                     @RequestParam(value = "type", required = false) String searchType) {
        return service.search(query, searchType);
    }

    @PostMapping("/interactions")
    public List<InteractionRecord> interactions(@RequestBody InteractionRequest request) {
        return service.checkInteractions(request.medications());
    }
}
