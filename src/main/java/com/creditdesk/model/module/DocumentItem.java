package com.creditdesk.model.module;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record DocumentItem(
        String id,
        String name,
        String type,           // "kbis" | "bilan" | "permis" | "plan" | "attestation" | "autre"
        Status status,
        String receivedOn,
        String comment
) {
    public enum Status {
        @JsonProperty("attendu") EXPECTED,
        @JsonProperty("recu") RECEIVED,
        @JsonProperty("valide") VALIDATED,
        @JsonProperty("refuse") REFUSED,
        @JsonProperty("non_applicable") NOT_APPLICABLE;

        public boolean isProvided() {
            return this == RECEIVED || this == VALIDATED;
        }
    }
}
