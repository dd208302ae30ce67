package com.creditdesk.service.profitability;

import com.creditdesk.config.BanqueProperties;
import com.creditdesk.model.financial.Decision;
import com.creditdesk.model.financial.ProfitabilityAnalysis;
import com.creditdesk.model.financial.ProfitabilityInput;
import com.creditdesk.model.financial.ProfitabilityResult;
import com.creditdesk.model.financial.ScenarioSet;
import com.creditdesk.model.financial.Strategy;
import com.creditdesk.model.financial.StressTestSet;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProfitabilityCalculatorTest {

    private final ProfitabilityCalculator calculator = new ProfitabilityCalculator(new BanqueProperties());

    private static ProfitabilityInput.ProfitabilityInputBuilder resale() {
        return ProfitabilityInput.builder()
                .strategy(Strategy.RESALE)
                .purchasePrice(200_000)
                .notaryFeePct(8)
                .worksBudget(30_000)
                .miscFees(5_000)
                .targetResalePrice(270_000)
                .durationMonths(12)
                .cashContribution(50_000);
    }

    private static ProfitabilityInput.ProfitabilityInputBuilder rental() {
        return ProfitabilityInput.builder()
                .strategy(Strategy.RENTAL)
                .purchasePrice(200_000)
                .monthlyRent(1_200)
                .monthlyCharges(100)
                .annualPropertyTax(1_000)
                .marginalTaxPct(30);
    }

    @Test
    void boundaryCaseWithoutNotaryFeeIsGoWithReserves() {
        ProfitabilityResult result = calculator.compute(resale().notaryFeePct(0).build());

        assertThat(result.notaryFee()).isZero();
        assertThat(result.totalCost()).isEqualTo(235_000.0);
        assertThat(result.grossMargin()).isEqualTo(35_000.0);
        assertThat(result.marginPct()).isEqualTo(14.89);
        assertThat(result.roiPct()).isEqualTo(70.0);
        assertThat(result.annualizedReturnPct()).isEqualTo(14.89);
        assertThat(result.decision()).isEqualTo(Decision.GO_WITH_RESERVES);
        assertThat(result.reasons()).contains("Marge entre 10 et 15 %", "TRI < 15 %");
    }

    @Test
    void notaryFeeIsAddedToTotalCost() {
        ProfitabilityResult result = calculator.compute(resale().build());

        assertThat(result.notaryFee()).isEqualTo(16_000.0);
        assertThat(result.totalCost()).isEqualTo(251_000.0);
        assertThat(result.grossMargin()).isEqualTo(19_000.0);
        assertThat(result.marginPct()).isEqualTo(7.57);
        assertThat(result.roiPct()).isEqualTo(38.0);
        assertThat(result.decision()).isEqualTo(Decision.NO_GO);
        assertThat(result.reasons()).contains("Marge < 10 %", "Marge brute < 30 000 €");
    }

    @Test
    void allGoThresholdsGiveGo() {
        ProfitabilityResult result = calculator.compute(resale().notaryFeePct(0).targetResalePrice(300_000).build());

        assertThat(result.marginPct()).isEqualTo(27.66);
        assertThat(result.grossMargin()).isEqualTo(65_000.0);
        assertThat(result.decision()).isEqualTo(Decision.GO);
        assertThat(result.reasons()).containsExactly("Marge ≥ 15 %", "Marge brute ≥ 30 000 €", "TRI ≥ 20 %");
    }

    @Test
    void highMarginOnLongDurationIsGoWithReserves() {
        // 27.66 % margin over 24 months annualizes below 20 %
        ProfitabilityResult result = calculator.compute(resale()
                .notaryFeePct(0).targetResalePrice(300_000).durationMonths(24).build());

        assertThat(result.annualizedReturnPct()).isEqualTo(13.83);
        assertThat(result.decision()).isEqualTo(Decision.GO_WITH_RESERVES);
    }

    @Test
    void decisionNeverDropsWhenResalePriceRises() {
        Decision previous = Decision.NO_GO;
        for (double price = 150_000; price <= 400_000; price += 2_500) {
            Decision decision = calculator.compute(resale().targetResalePrice(price).build()).decision();
            assertThat(decision.compareTo(previous))
                    .as("decision at resale price %s", price)
                    .isGreaterThanOrEqualTo(0);
            previous = decision;
        }
        assertThat(previous).isEqualTo(Decision.GO);
    }

    @Test
    void zeroTotalCostAndDurationDoNotDivide() {
        ProfitabilityResult result = calculator.compute(ProfitabilityInput.builder().build());

        assertThat(result.totalCost()).isZero();
        assertThat(result.marginPct()).isZero();
        assertThat(result.roiPct()).isZero();
        assertThat(result.annualizedReturnPct()).isZero();
        assertThat(result.decision()).isEqualTo(Decision.NO_GO);
    }

    @Test
    void scenariosAreIndependentRuns() {
        ProfitabilityInput input = resale().build();
        ScenarioSet scenarios = calculator.scenarios(input);

        assertThat(scenarios.base()).isEqualTo(calculator.compute(input));
        assertThat(scenarios.optimistic()).isEqualTo(calculator.compute(input
                .withTargetResalePrice(270_000 * 1.03)
                .withWorksBudget(30_000 * 0.95)));
        assertThat(scenarios.pessimistic()).isEqualTo(calculator.compute(input
                .withTargetResalePrice(270_000 * 0.95)
                .withWorksBudget(30_000 * 1.10)));
        assertThat(scenarios.optimistic().grossMargin()).isGreaterThan(scenarios.base().grossMargin());
        assertThat(scenarios.pessimistic().grossMargin()).isLessThan(scenarios.base().grossMargin());
    }

    @Test
    void stressTestsPerturbOneVariableEach() {
        ProfitabilityInput input = resale().build();
        StressTestSet stress = calculator.stressTests(input);

        assertThat(stress.resaleMinus5().totalCost()).isEqualTo(251_000.0);
        assertThat(stress.resaleMinus5().grossMargin()).isEqualTo(5_500.0);
        assertThat(stress.worksPlus10().totalCost()).isEqualTo(254_000.0);
        assertThat(stress.worksPlus10().grossMargin()).isEqualTo(16_000.0);
    }

    @Test
    void computeAllKeepsInputAndTimestamp() {
        ProfitabilityInput input = resale().build();
        Instant at = Instant.parse("2026-01-01T00:00:00Z");

        ProfitabilityAnalysis analysis = calculator.computeAll(input, at);

        assertThat(analysis.input()).isEqualTo(input);
        assertThat(analysis.computedAt()).isEqualTo(at);
        assertThat(analysis.base()).isEqualTo(calculator.compute(input));
    }

    @Test
    void rentalWithGoodYieldIsGo() {
        ProfitabilityResult result = calculator.compute(rental().build());

        assertThat(result.monthlyCashflow()).isEqualTo(711.67);
        assertThat(result.grossYieldPct()).isEqualTo(7.2);
        assertThat(result.decision()).isEqualTo(Decision.GO);
        assertThat(result.reasons()).containsExactly("Cashflow positif", "Rendement brut ≥ 5 %");
    }

    @Test
    void rentalWithLowYieldIsGoWithReserves() {
        ProfitabilityResult result = calculator.compute(rental().monthlyRent(700).build());

        assertThat(result.grossYieldPct()).isEqualTo(4.2);
        assertThat(result.monthlyCashflow()).isEqualTo(361.67);
        assertThat(result.decision()).isEqualTo(Decision.GO_WITH_RESERVES);
    }

    @Test
    void rentalWithNegativeCashflowIsNoGo() {
        ProfitabilityResult result = calculator.compute(rental().monthlyRent(200).monthlyCharges(300).build());

        assertThat(result.monthlyCashflow()).isEqualTo(-183.33);
        assertThat(result.decision()).isEqualTo(Decision.NO_GO);
        assertThat(result.reasons()).contains("Cashflow négatif");
    }

    @Test
    void flatTaxReplacesMarginalRate() {
        ProfitabilityResult result = calculator.compute(rental().useFlatTax(true).flatTaxPct(10).build());

        // (12 200 - 1 220) / 12
        assertThat(result.monthlyCashflow()).isEqualTo(915.0);
    }

    @Test
    void customThresholdsAreApplied() {
        BanqueProperties properties = new BanqueProperties();
        properties.getDecision().setReserveMarginPct(5);
        ProfitabilityCalculator lenient = new ProfitabilityCalculator(properties);

        assertThat(lenient.compute(resale().build()).decision()).isEqualTo(Decision.GO_WITH_RESERVES);
    }
}
