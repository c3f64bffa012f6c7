package com.mead.assistant.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.mead.assistant.knowledge.InteractionRecord;
import com.mead.assistant.search.SearchResult;

import java.util.List;

/**
 * Everything the presentation layer needs to render the answer to one query.
 * <p>
 * {@code message} and {@code suggestions} are only filled for the "no results" case;
 * {@code emergencyAlert} is null unless an emergency keyword was found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseBundle(
        String query,
        String message,
        List<String> suggestions,
        EmergencyAlert emergencyAlert,
        List<SearchResult> primaryResults,
        List<SearchResult> secondaryResults,
        List<String> relatedInformation,
        List<String> recommendations,
        List<String> seekHelpAdvice,
        List<InteractionRecord> interactionWarnings,
        String disclaimer,
        List<String> sources
) {

    @JsonIgnore
    public boolean hasResults() {
        return !primaryResults.isEmpty();
    }

    @JsonIgnore
    public boolean isEmergency() {
        return emergencyAlert != null;
    }
}
