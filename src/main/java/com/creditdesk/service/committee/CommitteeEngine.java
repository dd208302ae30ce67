package com.creditdesk.service.committee;

import com.creditdesk.model.report.AcceptanceDriver;
import com.creditdesk.model.report.AcceptanceProbability;
import com.creditdesk.model.report.CommitteeOutlook;
import com.creditdesk.model.report.DecisionScenario;
import com.creditdesk.model.report.DecisionScenario.Outcome;
import com.creditdesk.model.report.DecisionScenario.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Prepares the credit committee: how three risk appetites would decide, and
 * how likely the dossier is to be accepted.
 *
 * DECISION SCENARIOS:
 * ===================
 * - Conservative: NO GO on a DSCR below 1 or 3+ missing data, strict
 *   conditions on any missing data or an LTV above 60%
 * - Balanced: GO only with an LTV under 50%, nothing missing and a DSCR of
 *   at least 1.2 when known
 * - Opportunistic: "GO patrimonial" on an LTV under 50% in a market that is
 *   not weak
 *
 * ACCEPTANCE PROBABILITY:
 * =======================
 * Baseline 50, moved by the DSCR, LTV, SmartScore and market bands and by
 * 3 points per missing item (20 at most), clamped to 0-100. Margin and
 * yield are listed as drivers without moving the score.
 *
 * Pure: same inputs, same outlook.
 */
@Component
public class CommitteeEngine {

    static final int BASELINE = 50;
    static final int MISSING_PENALTY_CAP = 20;

    public CommitteeOutlook outlook(CommitteeInputs inputs) {
        return new CommitteeOutlook(decisionScenarios(inputs), acceptanceProbability(inputs));
    }

    // ==================== DECISION SCENARIOS ====================

    public List<DecisionScenario> decisionScenarios(CommitteeInputs inputs) {
        List<String> pros = commonPros(inputs);
        List<String> cons = commonCons(inputs);
        return List.of(
                conservative(inputs, pros, cons),
                balanced(inputs, pros, cons),
                opportunistic(inputs, pros, cons));
    }

    private DecisionScenario conservative(CommitteeInputs inputs, List<String> pros, List<String> cons) {
        Double dscr = inputs.dscr();
        Double ltv = inputs.ltv();
        List<String> missing = inputs.missing();
        int score = inputs.score() == null ? 0 : inputs.score();

        List<String> conditions = new ArrayList<>();
        List<String> targets = new ArrayList<>();
        Outcome decision;
        int confidence;
        if ((dscr != null && dscr < 1) || missing.size() >= 3) {
            decision = Outcome.NO_GO;
            confidence = dscr != null && dscr < 0.8 ? 85 : 70;
            targets.add("Restructurer le plan de financement");
            if (dscr != null && dscr < 1) {
                targets.add("Amener le DSCR au-dessus de 1.0");
            }
            if (missing.size() >= 3) {
                targets.add("Compléter les données manquantes");
            }
        } else if (!missing.isEmpty() || (ltv != null && ltv > 60)) {
            decision = Outcome.GO_STRICT_CONDITIONS;
            confidence = 55;
            conditions.addAll(first(missing, 5));
            if (ltv != null && ltv > 60) {
                conditions.add("Réduire le LTV sous 60%");
            }
            targets.add("Levée intégrale des conditions avant engagement");
        } else if (score < 70) {
            decision = Outcome.GO_CONDITIONS;
            confidence = 60;
            conditions.add("Suivi trimestriel renforcé");
        } else {
            decision = Outcome.GO;
            confidence = 75;
        }
        return scenario(Profile.CONSERVATIVE, "Conservateur", decision, confidence, pros, cons, conditions, targets);
    }

    private DecisionScenario balanced(CommitteeInputs inputs, List<String> pros, List<String> cons) {
        Double dscr = inputs.dscr();
        Double ltv = inputs.ltv();
        List<String> missing = inputs.missing();

        List<String> conditions = new ArrayList<>();
        List<String> targets = new ArrayList<>();
        Outcome decision;
        int confidence;
        if (ltv != null && ltv < 50 && missing.isEmpty() && (dscr == null || dscr >= 1.2)) {
            decision = Outcome.GO;
            confidence = 80;
        } else if (dscr != null && dscr < 1 && missing.size() >= 3) {
            decision = Outcome.NO_GO;
            confidence = 75;
            targets.add("Revoir le plan de financement");
        } else {
            decision = Outcome.GO_CONDITIONS;
            confidence = 65;
            conditions.addAll(first(missing, 4));
            if (ltv != null && ltv > 70) {
                conditions.add("Renforcer les garanties");
            }
            if (dscr != null && dscr < 1.2) {
                conditions.add("Suivi DSCR semestriel");
            }
        }
        return scenario(Profile.BALANCED, "Équilibré", decision, confidence, pros, cons, conditions, targets);
    }

    private DecisionScenario opportunistic(CommitteeInputs inputs, List<String> pros, List<String> cons) {
        Double dscr = inputs.dscr();
        Double ltv = inputs.ltv();
        Integer market = inputs.marketScore();

        List<String> conditions = new ArrayList<>();
        List<String> targets = new ArrayList<>();
        Outcome decision;
        int confidence;
        if (ltv != null && ltv < 50 && (market == null || market > 50)) {
            decision = Outcome.GO_PATRIMONIAL;
            confidence = 75;
            if (dscr != null && dscr < 1) {
                conditions.add("Réserve de couverture temporaire du service de la dette");
            }
        } else {
            decision = Outcome.GO_CONDITIONS;
            confidence = 60;
            conditions.addAll(first(inputs.missing(), 3));
            if (ltv != null && ltv >= 50) {
                conditions.add("Renforcer l'apport pour réduire le LTV");
            }
        }
        targets.add("Valorisation patrimoniale long terme");
        if (inputs.yieldPct() != null && inputs.yieldPct() >= 6) {
            targets.add("Capitaliser sur le rendement locatif");
        }
        return scenario(Profile.OPPORTUNISTIC, "Opportuniste", decision, confidence, pros, cons, conditions, targets);
    }

    private List<String> commonPros(CommitteeInputs inputs) {
        List<String> pros = new ArrayList<>();
        if (inputs.dscr() != null && inputs.dscr() >= 1.2) {
            pros.add("Couverture de dette satisfaisante (DSCR " + ratio(inputs.dscr()) + ")");
        }
        if (inputs.ltv() != null && inputs.ltv() <= 50) {
            pros.add("Levier contenu (LTV " + percent(inputs.ltv()) + "%)");
        }
        if (inputs.marketScore() != null && inputs.marketScore() >= 60) {
            pros.add("Marché porteur (score " + inputs.marketScore() + "/100)");
        }
        if (inputs.score() != null && inputs.score() >= 65) {
            pros.add("SmartScore solide (" + inputs.score() + "/100)");
        }
        first(inputs.strongPillars(), 2).forEach(pillar -> pros.add("Pilier fort : " + pillar));
        return pros;
    }

    private List<String> commonCons(CommitteeInputs inputs) {
        List<String> cons = new ArrayList<>();
        if (inputs.dscr() != null && inputs.dscr() < 1) {
            cons.add("DSCR insuffisant (" + ratio(inputs.dscr()) + ")");
        }
        if (inputs.ltv() != null && inputs.ltv() > 70) {
            cons.add("LTV élevé (" + percent(inputs.ltv()) + "%)");
        }
        if (inputs.marketScore() != null && inputs.marketScore() < 40) {
            cons.add("Marché défavorable (" + inputs.marketScore() + "/100)");
        }
        if (!inputs.missing().isEmpty()) {
            cons.add(inputs.missing().size() + " donnée(s) manquante(s)");
        }
        first(inputs.weakPillars(), 2).forEach(pillar -> cons.add("Pilier faible : " + pillar));
        return cons;
    }

    private static DecisionScenario scenario(Profile profile, String label, Outcome decision, int confidence,
                                             List<String> pros, List<String> cons,
                                             List<String> conditions, List<String> targets) {
        return new DecisionScenario(profile, label, decision, confidence,
                pros.isEmpty() ? List.of("Aucun point favorable majeur identifié") : pros,
                cons.isEmpty() ? List.of("Aucun point défavorable majeur") : cons,
                conditions, targets);
    }

    // ==================== ACCEPTANCE PROBABILITY ====================

    public AcceptanceProbability acceptanceProbability(CommitteeInputs inputs) {
        List<AcceptanceDriver> scored = new ArrayList<>();
        if (inputs.dscr() != null) {
            scored.add(dscrDriver(inputs.dscr()));
        }
        if (inputs.ltv() != null) {
            scored.add(ltvDriver(inputs.ltv()));
        }
        if (inputs.score() != null) {
            scored.add(scoreDriver(inputs.score()));
        }
        if (inputs.marketScore() != null) {
            scored.add(marketDriver(inputs.marketScore()));
        }
        if (!inputs.missing().isEmpty()) {
            scored.add(new AcceptanceDriver("Données manquantes", inputs.missing().size() + " élément(s)",
                    -Math.min(inputs.missing().size() * 3, MISSING_PENALTY_CAP)));
        }
        int score = BASELINE + scored.stream().mapToInt(AcceptanceDriver::impact).sum();

        List<AcceptanceDriver> drivers = new ArrayList<>(scored);
        if (inputs.marginPct() != null) {
            if (inputs.marginPct() > 15) {
                drivers.add(new AcceptanceDriver("Marge brute", percent(inputs.marginPct()) + "% : confortable", 5));
            } else if (inputs.marginPct() < 5) {
                drivers.add(new AcceptanceDriver("Marge brute", percent(inputs.marginPct()) + "% : serrée", -5));
            }
        }
        if (inputs.yieldPct() != null) {
            String yield = String.format(Locale.ROOT, "%.1f", inputs.yieldPct());
            if (inputs.yieldPct() >= 7) {
                drivers.add(new AcceptanceDriver("Rendement brut", yield + "% : attractif", 4));
            } else if (inputs.yieldPct() < 4) {
                drivers.add(new AcceptanceDriver("Rendement brut", yield + "% : faible", -4));
            }
        }
        // Stable: equal impacts keep their insertion order
        drivers.sort(Comparator.comparingInt((AcceptanceDriver driver) -> Math.abs(driver.impact())).reversed());
        return new AcceptanceProbability(Math.max(0, Math.min(100, score)), drivers);
    }

    private static AcceptanceDriver dscrDriver(double dscr) {
        String value = ratio(dscr);
        if (dscr >= 1.5) {
            return new AcceptanceDriver("DSCR", value + " : couverture très confortable", 18);
        }
        if (dscr >= 1.3) {
            return new AcceptanceDriver("DSCR", value + " : couverture solide", 14);
        }
        if (dscr >= 1.2) {
            return new AcceptanceDriver("DSCR", value + " : acceptable", 10);
        }
        if (dscr >= 1.0) {
            return new AcceptanceDriver("DSCR", value + " : juste suffisant", 2);
        }
        return new AcceptanceDriver("DSCR", value + " : déficit de couverture", dscr >= 0.9 ? -12 : -25);
    }

    private static AcceptanceDriver ltvDriver(double ltv) {
        String value = percent(ltv) + "%";
        if (ltv <= 40) {
            return new AcceptanceDriver("LTV", value + " : structure très prudente", 15);
        }
        if (ltv <= 50) {
            return new AcceptanceDriver("LTV", value + " : levier contenu", 10);
        }
        if (ltv <= 60) {
            return new AcceptanceDriver("LTV", value + " : standard", 5);
        }
        if (ltv <= 70) {
            return new AcceptanceDriver("LTV", value + " : fourchette haute", -2);
        }
        if (ltv <= 80) {
            return new AcceptanceDriver("LTV", value + " : élevé", -8);
        }
        return new AcceptanceDriver("LTV", value + " : très élevé", -18);
    }

    private static AcceptanceDriver scoreDriver(int score) {
        String value = score + "/100";
        if (score >= 75) {
            return new AcceptanceDriver("SmartScore", value + " : excellent", 12);
        }
        if (score >= 60) {
            return new AcceptanceDriver("SmartScore", value + " : bon", 7);
        }
        if (score >= 45) {
            return new AcceptanceDriver("SmartScore", value + " : moyen", 0);
        }
        return new AcceptanceDriver("SmartScore", value + " : faible", score >= 30 ? -6 : -14);
    }

    private static AcceptanceDriver marketDriver(int market) {
        String value = "Score " + market + "/100";
        if (market >= 70) {
            return new AcceptanceDriver("Marché", value + " : porteur", 8);
        }
        if (market >= 50) {
            return new AcceptanceDriver("Marché", value + " : neutre", 3);
        }
        if (market >= 30) {
            return new AcceptanceDriver("Marché", value + " : tendu", -3);
        }
        return new AcceptanceDriver("Marché", value + " : défavorable", -10);
    }

    // ==================== HELPERS ====================

    private static List<String> first(List<String> values, int count) {
        return values.subList(0, Math.min(count, values.size()));
    }

    private static String ratio(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    // 66.7 -> "66.7", 45.0 -> "45"
    private static String percent(double value) {
        double rounded = Math.round(value * 10) / 10.0;
        return rounded == Math.rint(rounded) ? String.valueOf((long) rounded) : String.valueOf(rounded);
    }
}
