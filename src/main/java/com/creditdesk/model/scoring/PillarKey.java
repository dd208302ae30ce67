package com.creditdesk.model.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scoring dimensions of the SmartScore, in evaluation order.
 * The code is both the persisted value and the key of the weight table.
 */
public enum PillarKey {
    @JsonProperty("documentation") DOCUMENTATION("documentation", "Documentation"),
    @JsonProperty("garanties") GUARANTEES("garanties", "Garanties & Sûretés"),
    @JsonProperty("emprunteur") BORROWER("emprunteur", "Identification emprunteur"),
    @JsonProperty("projet") PROJECT("projet", "Données projet"),
    @JsonProperty("financier") FINANCIAL("financier", "Profil financier");

    private final String code;
    private final String label;

    PillarKey(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }
}
