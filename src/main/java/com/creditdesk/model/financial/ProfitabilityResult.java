package com.creditdesk.model.financial;

import java.util.List;

/**
 * Derived profitability metrics, rounded to 2 decimals.
 */
public record ProfitabilityResult(
        double notaryFee,
        double totalCost,
        double grossMargin,
        double marginPct,
        double roiPct,
        double annualizedReturnPct,
        double monthlyCashflow,
        double grossYieldPct,
        Decision decision,
        List<String> reasons
) {
    public ProfitabilityResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
