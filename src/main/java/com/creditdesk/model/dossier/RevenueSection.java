package com.creditdesk.model.dossier;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Revenue model used for repayment capacity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueSection {

    private Mode mode;

    // Residence / individual borrower
    private Double incomeMonthlyNet;
    private Double otherDebtMonthly;

    // Rental
    private Double rentMonthly;
    private Double chargesMonthly;
    private Double propertyTaxAnnual;
    private Double vacancyRatePct;

    private String notes;

    public enum Mode {
        @JsonProperty("residence") RESIDENCE,
        @JsonProperty("locatif") LOCATIF
    }
}
