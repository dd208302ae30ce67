package com.creditdesk.model.financial;

public record ScenarioSet(
        ProfitabilityResult base,
        ProfitabilityResult optimistic,
        ProfitabilityResult pessimistic
) {
}
