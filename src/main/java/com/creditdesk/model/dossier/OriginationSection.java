package com.creditdesk.model.dossier;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Loan request and project identification captured at origination.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OriginationSection {

    private Double loanAmount;
    private Integer durationMonths;
    private Double interestRatePct;   // requested nominal rate
    private LoanType loanType;
    private ProjectType projectType;

    private String projectAddress;
    private String postalCode;
    private String commune;

    private Double landSurface;
    private Double floorSurface;

    private String receivedOn;
    private String notes;

    public enum LoanType {
        @JsonProperty("promotion") PROMOTION("Promotion immobilière"),
        @JsonProperty("logement") LOGEMENT("Logement"),
        @JsonProperty("marchand") MARCHAND("Marchand de biens"),
        @JsonProperty("investissement") INVESTISSEMENT("Investissement locatif"),
        @JsonProperty("rehabilitation") REHABILITATION("Réhabilitation"),
        @JsonProperty("autre") AUTRE("Autre");

        private final String label;

        LoanType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public enum ProjectType {
        @JsonProperty("promotion_residentielle") PROMOTION_RESIDENTIELLE,
        @JsonProperty("promotion_commerciale") PROMOTION_COMMERCIALE,
        @JsonProperty("marchand_de_biens") MARCHAND_DE_BIENS,
        @JsonProperty("ehpad") EHPAD,
        @JsonProperty("residence_etudiante") RESIDENCE_ETUDIANTE,
        @JsonProperty("logistique") LOGISTIQUE,
        @JsonProperty("bureaux") BUREAUX,
        @JsonProperty("autre") AUTRE
    }
}
