package com.creditdesk.model.module;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credit committee opinion. Anything but {@link #PENDING} is a rendered decision.
 */
public enum CommitteeVerdict {
    @JsonProperty("en_attente") PENDING("En attente"),
    @JsonProperty("favorable") FAVORABLE("Favorable"),
    @JsonProperty("favorable_sous_conditions") FAVORABLE_WITH_CONDITIONS("Favorable sous conditions"),
    @JsonProperty("defavorable") UNFAVORABLE("Défavorable"),
    @JsonProperty("ajourne") POSTPONED("Ajourné");

    private final String label;

    CommitteeVerdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean rendered() {
        return this != PENDING;
    }
}
