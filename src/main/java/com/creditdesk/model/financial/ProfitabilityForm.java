package com.creditdesk.model.financial;

import lombok.Builder;

/**
 * Raw, locale-formatted values as typed by the analyst ("200 000 €", "8 %", "1,5").
 */
@Builder
public record ProfitabilityForm(
        Strategy strategy,
        String purchasePrice,
        String notaryFeePct,
        String worksBudget,
        String miscFees,
        String durationMonths,
        String surface,
        String targetResalePrice,
        String monthlyRent,
        String monthlyCharges,
        String annualPropertyTax,
        String marginalTaxPct,
        String flatTaxPct,
        boolean useFlatTax,
        String cashContribution
) {
}
