package com.creditdesk.model.financial;

import java.time.Instant;

public record ProfitabilityAnalysis(
        ProfitabilityInput input,
        ScenarioSet scenarios,
        StressTestSet stressTests,
        Instant computedAt
) {
    public ProfitabilityResult base() {
        return scenarios == null ? null : scenarios.base();
    }
}
