package com.creditdesk.model.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Verdict {
    @JsonProperty("favorable") FAVORABLE("Favorable"),
    @JsonProperty("favorable_sous_conditions") FAVORABLE_WITH_CONDITIONS("Favorable sous conditions"),
    @JsonProperty("defavorable") UNFAVORABLE("Défavorable"),
    @JsonProperty("donnees_insuffisantes") INSUFFICIENT_DATA("Données insuffisantes");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
