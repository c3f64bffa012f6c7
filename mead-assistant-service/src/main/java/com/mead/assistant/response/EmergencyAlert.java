package com.mead.assistant.response;

import java.util.List;

/**
 * Attached to a response when the raw query mentions an urgent symptom.
 */
public record EmergencyAlert(
        String message,
        List<String> emergencyContacts,
        List<String> matchedKeywords
) {

    public EmergencyAlert {
        emergencyContacts = emergencyContacts == null ? List.of() : List.copyOf(emergencyContacts);
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }
}
