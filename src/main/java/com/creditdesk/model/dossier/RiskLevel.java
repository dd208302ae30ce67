package com.creditdesk.model.dossier;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk levels used both for individual risk items and for the dossier's
 * global level derived from the SmartScore.
 */
public enum RiskLevel {
    @JsonProperty("faible") LOW,         // Score >= 80, well covered dossier
    @JsonProperty("modere") MEDIUM,      // Some gaps, acceptable with conditions
    @JsonProperty("eleve") HIGH,         // Weak coverage or missing key data
    @JsonProperty("critique") CRITICAL;  // Major red flags

    public String label() {
        return switch (this) {
            case LOW -> "Faible";
            case MEDIUM -> "Modéré";
            case HIGH -> "Élevé";
            case CRITICAL -> "Critique";
        };
    }

    public static RiskLevel fromScore(int score) {
        if (score >= 80) {
            return LOW;
        }
        if (score >= 60) {
            return MEDIUM;
        }
        if (score >= 40) {
            return HIGH;
        }
        return CRITICAL;
    }
}
