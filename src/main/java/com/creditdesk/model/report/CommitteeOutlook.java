package com.creditdesk.model.report;

import java.util.List;

/**
 * Committee preparation section: the three decision scenarios, conservative
 * first, and the acceptance probability.
 */
public record CommitteeOutlook(
        List<DecisionScenario> scenarios,
        AcceptanceProbability acceptance
) {
    public CommitteeOutlook {
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
    }
}
