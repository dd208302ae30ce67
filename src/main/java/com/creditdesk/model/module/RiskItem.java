package com.creditdesk.model.module;

import com.creditdesk.model.dossier.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * One identified risk (geo, market, legal, construction, financial...).
 */
@Builder
public record RiskItem(
        String id,
        String category,
        String label,
        RiskLevel level,
        Status status,
        String description,
        String mitigation
) {
    public enum Status {
        @JsonProperty("present") PRESENT,
        @JsonProperty("mitige") MITIGATED,
        @JsonProperty("inconnu") UNKNOWN
    }
}
