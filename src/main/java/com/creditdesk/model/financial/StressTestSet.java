package com.creditdesk.model.financial;

/**
 * Single-variable perturbations of the base case.
 */
public record StressTestSet(
        ProfitabilityResult resaleMinus5,
        ProfitabilityResult worksPlus10
) {
}
