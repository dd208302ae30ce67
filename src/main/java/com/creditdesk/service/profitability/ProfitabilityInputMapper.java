package com.creditdesk.service.profitability;

import com.creditdesk.model.dossier.AnalysisSection;
import com.creditdesk.model.dossier.BudgetSection;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.OriginationSection;
import com.creditdesk.model.dossier.RevenueSection;
import com.creditdesk.model.dossier.ScheduleSection;
import com.creditdesk.model.financial.ProfitabilityForm;
import com.creditdesk.model.financial.ProfitabilityInput;
import com.creditdesk.model.financial.Strategy;
import org.springframework.stereotype.Component;

/**
 * Builds calculator inputs, either from the analyst's form or from the dossier sections.
 */
@Component
public class ProfitabilityInputMapper {

    public ProfitabilityInput fromForm(ProfitabilityForm form) {
        return ProfitabilityInput.builder()
                .strategy(form.strategy())
                .purchasePrice(LocalizedNumberParser.parse(form.purchasePrice()))
                .notaryFeePct(LocalizedNumberParser.parse(form.notaryFeePct()))
                .worksBudget(LocalizedNumberParser.parse(form.worksBudget()))
                .miscFees(LocalizedNumberParser.parse(form.miscFees()))
                .durationMonths(LocalizedNumberParser.parse(form.durationMonths()))
                .surface(LocalizedNumberParser.parse(form.surface()))
                .targetResalePrice(LocalizedNumberParser.parse(form.targetResalePrice()))
                .monthlyRent(LocalizedNumberParser.parse(form.monthlyRent()))
                .monthlyCharges(LocalizedNumberParser.parse(form.monthlyCharges()))
                .annualPropertyTax(LocalizedNumberParser.parse(form.annualPropertyTax()))
                .marginalTaxPct(LocalizedNumberParser.parse(form.marginalTaxPct()))
                .flatTaxPct(LocalizedNumberParser.parse(form.flatTaxPct()))
                .useFlatTax(form.useFlatTax())
                .cashContribution(LocalizedNumberParser.parse(form.cashContribution()))
                .build();
    }

    /**
     * Input derived from the analysis and origination sections when no form was saved.
     * Missing figures read as 0, like an empty form field.
     */
    public ProfitabilityInput fromDossier(Dossier dossier) {
        AnalysisSection analysis = dossier.getAnalysis() == null ? new AnalysisSection() : dossier.getAnalysis();
        BudgetSection budget = analysis.getBudget() == null ? new BudgetSection() : analysis.getBudget();
        RevenueSection revenue = analysis.getRevenue() == null ? new RevenueSection() : analysis.getRevenue();
        ScheduleSection schedule = analysis.getSchedule();
        OriginationSection origination = dossier.getOrigination();

        Integer duration = schedule != null && schedule.getWorksMonths() != null
                ? schedule.getWorksMonths()
                : origination == null ? null : origination.getDurationMonths();

        return ProfitabilityInput.builder()
                .strategy(revenue.getMode() == RevenueSection.Mode.LOCATIF ? Strategy.RENTAL : Strategy.RESALE)
                .purchasePrice(value(budget.getPurchasePrice()))
                .notaryFeePct(value(budget.getNotaryFeePct()))
                .worksBudget(value(budget.getWorks()))
                .miscFees(value(budget.getFees()))
                .durationMonths(duration == null ? 0 : duration)
                .surface(origination == null ? 0 : value(origination.getFloorSurface()))
                .targetResalePrice(value(budget.getExitValue()))
                .monthlyRent(value(revenue.getRentMonthly()))
                .monthlyCharges(value(revenue.getChargesMonthly()))
                .annualPropertyTax(value(revenue.getPropertyTaxAnnual()))
                .cashContribution(value(budget.getEquity()))
                .build();
    }

    private static double value(Double number) {
        return number == null || !Double.isFinite(number) ? 0 : number;
    }
}
