package com.creditdesk.model.dossier;

import com.creditdesk.model.financial.ProfitabilityAnalysis;
import com.creditdesk.model.financial.ProfitabilityInput;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Credit analysis: structured inputs plus the last profitability computation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisSection {

    private BudgetSection budget;
    private RevenueSection revenue;
    private PropertySection property;
    private ScheduleSection schedule;

    // Written back by ProfitabilityService, never edited by hand
    private ProfitabilityInput profitabilityInput;
    private ProfitabilityAnalysis profitability;

    private String analystComment;
    private String analysedOn;
}
