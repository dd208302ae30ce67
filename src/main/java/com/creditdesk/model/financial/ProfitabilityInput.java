package com.creditdesk.model.financial;

import lombok.Builder;
import lombok.With;

/**
 * Numeric inputs of one profitability run. Amounts in EUR, rates in percent.
 */
@Builder(toBuilder = true)
@With
public record ProfitabilityInput(
        Strategy strategy,
        double purchasePrice,
        double notaryFeePct,
        double worksBudget,
        double miscFees,
        double durationMonths,
        double surface,
        double targetResalePrice,
        // Rental only
        double monthlyRent,
        double monthlyCharges,
        double annualPropertyTax,
        // Taxation
        double marginalTaxPct,
        double flatTaxPct,
        boolean useFlatTax,
        double cashContribution
) {
    public ProfitabilityInput {
        if (strategy == null) {
            strategy = Strategy.RESALE;
        }
    }
}
