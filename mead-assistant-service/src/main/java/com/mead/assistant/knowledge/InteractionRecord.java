package com.mead.assistant.knowledge;

import java.util.Locale;

/**
 * A documented interaction between two drugs (or drug classes).
 */
public record InteractionRecord(
        String primaryDrug,
        String partnerDrug,
        InteractionSeverity severity,
        String mechanism,
        String management
) {

    public InteractionRecord {
        if (primaryDrug == null || primaryDrug.isBlank() || partnerDrug == null || partnerDrug.isBlank()) {
            throw new IllegalArgumentException("Interaction record needs both drug names");
        }
        severity = severity == null ? InteractionSeverity.MODERATE : severity;
        mechanism = Defaults.text(mechanism);
        management = Defaults.text(management);
    }

    /**
     * Order-independent membership test: true when {@code drugName} is either side of the pair.
     * <p>
     * Names are compared whole, ignoring case and surrounding blanks. Unlike
     * {@link com.mead.assistant.interaction.InteractionChecker}, which matches by containment,
     * "warfarin sodium" does not involve "Warfarin" here.
     */
    public boolean involves(String drugName) {
        if (drugName == null) return false;
        String needle = drugName.trim().toLowerCase(Locale.ROOT);
        return primaryDrug.toLowerCase(Locale.ROOT).equals(needle)
                || partnerDrug.toLowerCase(Locale.ROOT).equals(needle);
    }
}
