package com.creditdesk.model.dossier;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Condition of the financed property.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertySection {

    private Condition condition;
    private Conformity conformity;
    private String notes;

    public enum Condition {
        @JsonProperty("neuf") NEUF,
        @JsonProperty("bon") BON,
        @JsonProperty("moyen") MOYEN,
        @JsonProperty("mauvais") MAUVAIS
    }

    public enum Conformity {
        @JsonProperty("ok") OK,
        @JsonProperty("incertain") INCERTAIN,
        @JsonProperty("ko") KO
    }
}
