package com.creditdesk.model.dossier;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acquisition budget (EUR). Purchase price is required for scoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetSection {

    private Double purchasePrice;
    private Double notaryFeePct;
    private Double works;
    private Double fees;
    private Double equity;
    private Double exitValue;
    private String notes;
}
