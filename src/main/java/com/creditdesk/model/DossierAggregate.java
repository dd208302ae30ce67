package com.creditdesk.model;

import com.creditdesk.model.dossier.BudgetSection;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.OriginationSection;
import com.creditdesk.model.dossier.RevenueSection;
import com.creditdesk.model.module.CommitteeModule;
import com.creditdesk.model.module.DocumentItem;
import com.creditdesk.model.module.DocumentsModule;
import com.creditdesk.model.module.DossierModule;
import com.creditdesk.model.module.GuaranteeItem;
import com.creditdesk.model.module.GuaranteesModule;
import com.creditdesk.model.module.MarketModule;
import com.creditdesk.model.module.MonitoringAlert;
import com.creditdesk.model.module.MonitoringModule;
import com.creditdesk.model.module.RiskAnalysisModule;
import com.creditdesk.model.module.RiskItem;

import java.util.List;

/**
 * Read-only view of one dossier with its dossier-scoped modules.
 *
 * Modules stamped with another dossier id are left out.
 */
public record DossierAggregate(
        Dossier dossier,
        RiskAnalysisModule riskAnalysis,
        GuaranteesModule guarantees,
        DocumentsModule documents,
        CommitteeModule committee,
        MonitoringModule monitoring,
        MarketModule market
) {

    public static DossierAggregate from(Snapshot snapshot) {
        Dossier dossier = snapshot.getDossier();
        String id = dossier == null ? null : dossier.getId();
        return new DossierAggregate(
                dossier,
                scoped(snapshot.getRiskAnalysis(), id),
                scoped(snapshot.getGuarantees(), id),
                scoped(snapshot.getDocuments(), id),
                scoped(snapshot.getCommittee(), id),
                scoped(snapshot.getMonitoring(), id),
                scoped(snapshot.getMarket(), id));
    }

    public List<RiskItem> risks() {
        return riskAnalysis == null || riskAnalysis.getItems() == null ? List.of() : riskAnalysis.getItems();
    }

    public List<GuaranteeItem> guaranteeItems() {
        return guarantees == null || guarantees.getItems() == null ? List.of() : guarantees.getItems();
    }

    public List<DocumentItem> documentItems() {
        return documents == null || documents.getItems() == null ? List.of() : documents.getItems();
    }

    public List<MonitoringAlert> alerts() {
        return monitoring == null || monitoring.getAlerts() == null ? List.of() : monitoring.getAlerts();
    }

    /**
     * Declared total coverage, or the sum of the guarantees' estimated values when none was declared.
     */
    public double guaranteeCoverage() {
        if (guarantees != null && guarantees.getTotalCoverage() != null && guarantees.getTotalCoverage() > 0) {
            return guarantees.getTotalCoverage();
        }
        return guaranteeItems().stream()
                .mapToDouble(item -> item.estimatedValue() == null ? 0 : item.estimatedValue())
                .sum();
    }

    /**
     * Coverage as a whole percentage of the loan amount (120 = 120 %), null when
     * the loan amount or the coverage is unknown.
     */
    public Integer coverageRatioPct() {
        Double loanAmount = dossier == null || dossier.getOrigination() == null
                ? null
                : dossier.getOrigination().getLoanAmount();
        double coverage = guaranteeCoverage();
        if (loanAmount == null || loanAmount <= 0 || coverage <= 0) {
            return null;
        }
        return (int) Math.round(coverage / loanAmount * 100);
    }

    /**
     * Loan-to-value in percent, one decimal. The exit value is the collateral
     * value when known, else the purchase price. Null without loan or value.
     */
    public Double loanToValuePct() {
        Double loanAmount = loanAmount();
        BudgetSection budget = dossier == null || dossier.getAnalysis() == null ? null : dossier.getAnalysis().getBudget();
        if (loanAmount == null || loanAmount <= 0 || budget == null) {
            return null;
        }
        Double value = budget.getExitValue() != null && budget.getExitValue() > 0
                ? budget.getExitValue()
                : budget.getPurchasePrice();
        if (value == null || value <= 0) {
            return null;
        }
        return Math.round(loanAmount / value * 1_000) / 10.0;
    }

    /**
     * Debt service coverage of a rental dossier, two decimals: yearly net rent
     * over yearly loan instalments. Null outside rental mode or without rent,
     * loan amount or duration.
     *
     * The rate is the committee's granted rate, else the requested one, else 0.
     */
    public Double debtServiceCoverage() {
        RevenueSection revenue = dossier == null || dossier.getAnalysis() == null ? null : dossier.getAnalysis().getRevenue();
        OriginationSection origination = dossier == null ? null : dossier.getOrigination();
        Double loanAmount = loanAmount();
        if (revenue == null || revenue.getMode() != RevenueSection.Mode.LOCATIF
                || revenue.getRentMonthly() == null || revenue.getRentMonthly() <= 0
                || loanAmount == null || loanAmount <= 0
                || origination.getDurationMonths() == null || origination.getDurationMonths() <= 0) {
            return null;
        }
        double vacancy = revenue.getVacancyRatePct() == null ? 0 : revenue.getVacancyRatePct();
        double netRent = revenue.getRentMonthly() * 12 * (1 - vacancy / 100)
                - orZero(revenue.getChargesMonthly()) * 12
                - orZero(revenue.getPropertyTaxAnnual());
        double debtService = monthlyInstalment(loanAmount, interestRatePct(), origination.getDurationMonths()) * 12;
        return Math.round(netRent / debtService * 100) / 100.0;
    }

    private double interestRatePct() {
        if (committee != null && committee.getGrantedRatePct() != null) {
            return committee.getGrantedRatePct();
        }
        OriginationSection origination = dossier.getOrigination();
        return origination == null || origination.getInterestRatePct() == null ? 0 : origination.getInterestRatePct();
    }

    private Double loanAmount() {
        return dossier == null || dossier.getOrigination() == null ? null : dossier.getOrigination().getLoanAmount();
    }

    // Constant-instalment amortisation; straight division at a zero rate
    static double monthlyInstalment(double principal, double ratePct, int months) {
        double monthlyRate = ratePct / 100 / 12;
        if (monthlyRate <= 0) {
            return principal / months;
        }
        return principal * monthlyRate / (1 - Math.pow(1 + monthlyRate, -months));
    }

    private static double orZero(Double value) {
        return value == null ? 0 : value;
    }

    private static <M extends DossierModule> M scoped(M module, String dossierId) {
        if (module == null || dossierId == null) {
            return null;
        }
        return module.getDossierId() == null || module.getDossierId().equals(dossierId) ? module : null;
    }
}
