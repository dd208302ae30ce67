package com.creditdesk.service.committee;

import com.creditdesk.model.DossierAggregate;
import com.creditdesk.model.financial.ProfitabilityResult;
import com.creditdesk.model.module.MarketModule;
import com.creditdesk.model.report.AcceptanceDriver;
import com.creditdesk.model.report.AcceptanceProbability;
import com.creditdesk.model.report.DecisionScenario;
import com.creditdesk.model.report.DecisionScenario.Outcome;
import com.creditdesk.model.report.DecisionScenario.Profile;
import com.creditdesk.model.scoring.Grade;
import com.creditdesk.model.scoring.MissingDataItem;
import com.creditdesk.model.scoring.MissingSeverity;
import com.creditdesk.model.scoring.PillarKey;
import com.creditdesk.model.scoring.PillarResult;
import com.creditdesk.model.scoring.SmartScoreResult;
import com.creditdesk.model.scoring.Verdict;
import com.creditdesk.util.TestDossiers;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.creditdesk.util.TestDossiers.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class CommitteeEngineTest {

    private final CommitteeEngine engine = new CommitteeEngine();

    private static final CommitteeInputs STRONG = new CommitteeInputs(1.6, 40.0, 80, 75, List.of(), null, 7.5,
            List.of("Garanties & Sûretés", "Profil financier", "Documentation"), List.of());

    private static final CommitteeInputs WEAK = new CommitteeInputs(0.75, 85.0, 25, 20,
            List.of("Montant du prêt", "Bilan", "Kbis", "Avis d'imposition"), 3.0, null, List.of(), List.of());

    @Test
    void strongDossierIsGoForEveryProfile() {
        List<DecisionScenario> scenarios = engine.decisionScenarios(STRONG);

        assertThat(scenarios)
                .extracting(DecisionScenario::profile, DecisionScenario::decision, DecisionScenario::confidence)
                .containsExactly(
                        tuple(Profile.CONSERVATIVE, Outcome.GO, 75),
                        tuple(Profile.BALANCED, Outcome.GO, 80),
                        tuple(Profile.OPPORTUNISTIC, Outcome.GO_PATRIMONIAL, 75));
        assertThat(scenarios.get(0).pros()).containsExactly(
                "Couverture de dette satisfaisante (DSCR 1.60)",
                "Levier contenu (LTV 40%)",
                "Marché porteur (score 75/100)",
                "SmartScore solide (80/100)",
                "Pilier fort : Garanties & Sûretés",
                "Pilier fort : Profil financier");
        assertThat(scenarios.get(0).cons()).containsExactly("Aucun point défavorable majeur");
        assertThat(scenarios.get(2).targets())
                .containsExactly("Valorisation patrimoniale long terme", "Capitaliser sur le rendement locatif");
    }

    @Test
    void weakDossierIsRefusedByCautiousProfiles() {
        List<DecisionScenario> scenarios = engine.decisionScenarios(WEAK);

        DecisionScenario conservative = scenarios.get(0);
        assertThat(conservative.decision()).isEqualTo(Outcome.NO_GO);
        assertThat(conservative.decision().label()).isEqualTo("NO GO");
        assertThat(conservative.confidence()).isEqualTo(85);
        assertThat(conservative.targets()).containsExactly(
                "Restructurer le plan de financement",
                "Amener le DSCR au-dessus de 1.0",
                "Compléter les données manquantes");
        assertThat(conservative.pros()).containsExactly("Aucun point favorable majeur identifié");
        assertThat(conservative.cons()).containsExactly(
                "DSCR insuffisant (0.75)",
                "LTV élevé (85%)",
                "Marché défavorable (20/100)",
                "4 donnée(s) manquante(s)");

        assertThat(scenarios.get(1).decision()).isEqualTo(Outcome.NO_GO);
        assertThat(scenarios.get(2).decision()).isEqualTo(Outcome.GO_CONDITIONS);
        assertThat(scenarios.get(2).conditions()).containsExactly(
                "Montant du prêt", "Bilan", "Kbis", "Renforcer l'apport pour réduire le LTV");
    }

    @Test
    void missingDataOrHighLeverageGivesStrictConditions() {
        CommitteeInputs inputs = new CommitteeInputs(null, 65.0, 60, null, List.of("Bilan"), null, null,
                List.of(), List.of());

        List<DecisionScenario> scenarios = engine.decisionScenarios(inputs);

        assertThat(scenarios.get(0).decision()).isEqualTo(Outcome.GO_STRICT_CONDITIONS);
        assertThat(scenarios.get(0).conditions()).containsExactly("Bilan", "Réduire le LTV sous 60%");
        assertThat(scenarios.get(1).decision()).isEqualTo(Outcome.GO_CONDITIONS);
        assertThat(scenarios.get(1).conditions()).containsExactly("Bilan");
        // -2 for the LTV band, +7 for the score, -3 for one missing item
        assertThat(engine.acceptanceProbability(inputs).score()).isEqualTo(52);
    }

    @Test
    void unknownFiguresLeaveTheBaseline() {
        CommitteeInputs inputs = new CommitteeInputs(null, null, null, null, null, null, null, null, null);

        AcceptanceProbability acceptance = engine.acceptanceProbability(inputs);

        assertThat(acceptance.score()).isEqualTo(CommitteeEngine.BASELINE);
        assertThat(acceptance.drivers()).isEmpty();
        assertThat(engine.decisionScenarios(inputs).get(0).conditions()).containsExactly("Suivi trimestriel renforcé");
    }

    @Test
    void acceptanceIsClampedAndDriversSortedByImpact() {
        AcceptanceProbability strong = engine.acceptanceProbability(STRONG);
        assertThat(strong.score()).isEqualTo(100);
        assertThat(strong.drivers()).extracting(AcceptanceDriver::label, AcceptanceDriver::impact).containsExactly(
                tuple("DSCR", 18), tuple("LTV", 15), tuple("SmartScore", 12), tuple("Marché", 8),
                tuple("Rendement brut", 4));
        assertThat(strong.drivers().get(4).detail()).isEqualTo("7.5% : attractif");

        AcceptanceProbability weak = engine.acceptanceProbability(WEAK);
        assertThat(weak.score()).isZero();
        assertThat(weak.drivers()).extracting(AcceptanceDriver::label, AcceptanceDriver::impact).containsExactly(
                tuple("DSCR", -25), tuple("LTV", -18), tuple("SmartScore", -14), tuple("Données manquantes", -12),
                tuple("Marché", -10), tuple("Marge brute", -5));
    }

    @Test
    void inputsComeFromTheAggregateAndScore() {
        DossierAggregate aggregate = new DossierAggregate(TestDossiers.completeDossier(), null, null, null, null, null,
                MarketModule.builder().demandIndex(64).build());
        SmartScoreResult score = new SmartScoreResult(48, Grade.D, Verdict.FAVORABLE_WITH_CONDITIONS,
                List.of(
                        new PillarResult(PillarKey.GUARANTEES, "Garanties & Sûretés", 20, 25, 80, true, null, null),
                        new PillarResult(PillarKey.DOCUMENTATION, "Documentation", 0, 20, 10, false, null, null),
                        new PillarResult(PillarKey.FINANCIAL, "Profil financier", 6, 20, 30, true, null, null)),
                null, null,
                List.of(new MissingDataItem("property.surface", "Surface", MissingSeverity.WARN, 3)),
                3, null, null, NOW);
        ProfitabilityResult profitability = new ProfitabilityResult(16_000, 251_000, 19_000, 7.57, 38,
                3.79, 0, 0, null, null);

        CommitteeInputs inputs = CommitteeInputs.from(aggregate, profitability, score);

        assertThat(inputs.ltv()).isEqualTo(66.7);
        assertThat(inputs.dscr()).isNull();
        assertThat(inputs.score()).isEqualTo(48);
        assertThat(inputs.marketScore()).isEqualTo(64);
        assertThat(inputs.missing()).containsExactly("Surface");
        assertThat(inputs.marginPct()).isEqualTo(7.57);
        assertThat(inputs.yieldPct()).isNull();
        assertThat(inputs.strongPillars()).containsExactly("Garanties & Sûretés");
        assertThat(inputs.weakPillars()).containsExactly("Profil financier");
    }
}
