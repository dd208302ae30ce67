package com.creditdesk.service.profitability;

import com.creditdesk.config.BanqueProperties;
import com.creditdesk.model.financial.Decision;
import com.creditdesk.model.financial.ProfitabilityAnalysis;
import com.creditdesk.model.financial.ProfitabilityInput;
import com.creditdesk.model.financial.ProfitabilityResult;
import com.creditdesk.model.financial.ScenarioSet;
import com.creditdesk.model.financial.Strategy;
import com.creditdesk.model.financial.StressTestSet;
import org.springframework.stereotype.Component;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Profitability metrics and GO / GO_WITH_RESERVES / NO_GO classification of an operation.
 *
 * Pure: no state, no clock, no I/O. Thresholds and scenario multipliers come
 * from {@code banque.decision.*}.
 *
 * FORMULAS:
 * =========
 * notaryFee  = purchasePrice x notaryFeePct / 100
 * totalCost  = purchasePrice + notaryFee + worksBudget + miscFees
 * Resale:
 *   grossMargin         = targetResalePrice - totalCost
 *   marginPct           = grossMargin / totalCost x 100          (0 when totalCost <= 0)
 *   roiPct              = grossMargin / cashContribution x 100   (0 without contribution)
 *   annualizedReturnPct = marginPct x 12 / durationMonths        (0 when duration <= 0)
 * Rental:
 *   netIncome       = monthlyRent x 12 - (monthlyCharges x 12 + annualPropertyTax)
 *   tax             = max(0, netIncome x (flat tax or marginal rate) / 100)
 *   monthlyCashflow = (netIncome - tax) / 12
 *   grossYieldPct   = monthlyRent x 12 / purchasePrice x 100
 *   resale metrics as well when a target resale price is set
 *
 * Decisions use full precision; only the returned figures are rounded to 2 decimals.
 * Every scenario and stress test is a full, independent run of {@link #compute}.
 */
@Component
public class ProfitabilityCalculator {

    private final BanqueProperties.Decision thresholds;

    public ProfitabilityCalculator(BanqueProperties properties) {
        this.thresholds = properties.getDecision();
    }

    public ProfitabilityResult compute(ProfitabilityInput input) {
        double notaryFee = input.purchasePrice() * input.notaryFeePct() / 100;
        double totalCost = input.purchasePrice() + notaryFee + input.worksBudget() + input.miscFees();

        double grossMargin = 0;
        double marginPct = 0;
        double roiPct = 0;
        double annualizedReturnPct = 0;
        double monthlyCashflow = 0;
        double grossYieldPct = 0;

        boolean resale = input.strategy() == Strategy.RESALE;
        if (resale || input.targetResalePrice() > 0) {
            grossMargin = input.targetResalePrice() - totalCost;
            marginPct = totalCost > 0 ? grossMargin / totalCost * 100 : 0;
            roiPct = input.cashContribution() > 0 ? grossMargin / input.cashContribution() * 100 : 0;
            annualizedReturnPct = input.durationMonths() > 0 ? marginPct * 12 / input.durationMonths() : 0;
        }
        if (!resale) {
            double annualRent = input.monthlyRent() * 12;
            double netIncome = annualRent - (input.monthlyCharges() * 12 + input.annualPropertyTax());
            double taxRatePct = input.useFlatTax() ? input.flatTaxPct() : input.marginalTaxPct();
            double tax = Math.max(0, netIncome * taxRatePct / 100);
            monthlyCashflow = (netIncome - tax) / 12;
            grossYieldPct = input.purchasePrice() > 0 ? annualRent / input.purchasePrice() * 100 : 0;
        }

        List<String> reasons = new ArrayList<>();
        Decision decision = resale
                ? classifyResale(marginPct, grossMargin, annualizedReturnPct, reasons)
                : classifyRental(monthlyCashflow, grossYieldPct, reasons);

        return new ProfitabilityResult(
                round2(notaryFee),
                round2(totalCost),
                round2(grossMargin),
                round2(marginPct),
                round2(roiPct),
                round2(annualizedReturnPct),
                round2(monthlyCashflow),
                round2(grossYieldPct),
                decision,
                reasons);
    }

    /**
     * Base case plus optimistic (higher resale, cheaper works) and pessimistic variants.
     */
    public ScenarioSet scenarios(ProfitabilityInput input) {
        ProfitabilityResult base = compute(input);
        ProfitabilityResult optimistic = compute(input
                .withTargetResalePrice(input.targetResalePrice() * thresholds.getOptimisticResaleFactor())
                .withWorksBudget(input.worksBudget() * thresholds.getOptimisticWorksFactor()));
        ProfitabilityResult pessimistic = compute(input
                .withTargetResalePrice(input.targetResalePrice() * thresholds.getPessimisticResaleFactor())
                .withWorksBudget(input.worksBudget() * thresholds.getPessimisticWorksFactor()));
        return new ScenarioSet(base, optimistic, pessimistic);
    }

    /**
     * Single-variable perturbations: resale price down, works budget up.
     */
    public StressTestSet stressTests(ProfitabilityInput input) {
        ProfitabilityResult resaleDown = compute(
                input.withTargetResalePrice(input.targetResalePrice() * thresholds.getStressResaleFactor()));
        ProfitabilityResult worksUp = compute(
                input.withWorksBudget(input.worksBudget() * thresholds.getStressWorksFactor()));
        return new StressTestSet(resaleDown, worksUp);
    }

    public ProfitabilityAnalysis computeAll(ProfitabilityInput input, Instant computedAt) {
        return new ProfitabilityAnalysis(input, scenarios(input), stressTests(input), computedAt);
    }

    // ==================== CLASSIFICATION ====================

    /**
     * GO needs all three GO thresholds. Failing that, either reserve floor gives
     * GO_WITH_RESERVES; a higher resale price can therefore never lower the tier.
     */
    private Decision classifyResale(double marginPct, double grossMargin, double annualizedReturnPct,
                                    List<String> reasons) {
        double goMargin = thresholds.getGoMarginPct();
        double goGross = thresholds.getGoGrossMargin();
        double goAnnualized = thresholds.getGoAnnualizedReturnPct();
        double reserveMargin = thresholds.getReserveMarginPct();
        double reserveAnnualized = thresholds.getReserveAnnualizedReturnPct();

        if (marginPct >= goMargin && grossMargin >= goGross && annualizedReturnPct >= goAnnualized) {
            reasons.add("Marge ≥ " + pct(goMargin));
            reasons.add("Marge brute ≥ " + eur(goGross));
            reasons.add("TRI ≥ " + pct(goAnnualized));
            return Decision.GO;
        }

        if (marginPct >= goMargin) {
            reasons.add("Marge ≥ " + pct(goMargin));
        } else if (marginPct >= reserveMargin) {
            reasons.add("Marge entre " + number(reserveMargin) + " et " + pct(goMargin));
        } else {
            reasons.add("Marge < " + pct(reserveMargin));
        }
        if (grossMargin < goGross) {
            reasons.add("Marge brute < " + eur(goGross));
        }
        if (annualizedReturnPct >= goAnnualized) {
            reasons.add("TRI ≥ " + pct(goAnnualized));
        } else if (annualizedReturnPct >= reserveAnnualized) {
            reasons.add("TRI entre " + number(reserveAnnualized) + " et " + pct(goAnnualized));
        } else {
            reasons.add("TRI < " + pct(reserveAnnualized));
        }

        return marginPct >= reserveMargin || annualizedReturnPct >= reserveAnnualized
                ? Decision.GO_WITH_RESERVES
                : Decision.NO_GO;
    }

    private Decision classifyRental(double monthlyCashflow, double grossYieldPct, List<String> reasons) {
        boolean cashflowOk = monthlyCashflow >= thresholds.getMinMonthlyCashflow();
        boolean yieldOk = grossYieldPct >= thresholds.getMinGrossYieldPct();

        reasons.add(cashflowOk ? "Cashflow positif" : "Cashflow négatif");
        reasons.add((yieldOk ? "Rendement brut ≥ " : "Rendement brut < ") + pct(thresholds.getMinGrossYieldPct()));

        if (!cashflowOk) {
            return Decision.NO_GO;
        }
        return yieldOk ? Decision.GO : Decision.GO_WITH_RESERVES;
    }

    // ==================== FORMATTING ====================

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    private static String number(double value) {
        DecimalFormatSymbols symbols = new DecimalFormatSymbols(Locale.ROOT);
        symbols.setDecimalSeparator(',');
        symbols.setGroupingSeparator(' ');
        return new DecimalFormat("#,##0.##", symbols).format(value);
    }

    private static String pct(double value) {
        return number(value) + " %";
    }

    private static String eur(double value) {
        return number(value) + " €";
    }
}
