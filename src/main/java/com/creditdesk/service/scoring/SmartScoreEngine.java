package com.creditdesk.service.scoring;

import com.creditdesk.config.BanqueProperties;
import com.creditdesk.model.DossierAggregate;
import com.creditdesk.model.dossier.AnalysisSection;
import com.creditdesk.model.dossier.Borrower;
import com.creditdesk.model.dossier.CompanyBorrower;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.OriginationSection;
import com.creditdesk.model.dossier.PersonBorrower;
import com.creditdesk.model.dossier.RiskLevel;
import com.creditdesk.model.financial.ProfitabilityResult;
import com.creditdesk.model.module.AlertSeverity;
import com.creditdesk.model.module.DocumentItem;
import com.creditdesk.model.module.GuaranteeItem;
import com.creditdesk.model.module.MarketModule;
import com.creditdesk.model.module.MonitoringAlert;
import com.creditdesk.model.module.RiskItem;
import com.creditdesk.model.scoring.Grade;
import com.creditdesk.model.scoring.MissingDataItem;
import com.creditdesk.model.scoring.MissingSeverity;
import com.creditdesk.model.scoring.PillarKey;
import com.creditdesk.model.scoring.PillarResult;
import com.creditdesk.model.scoring.ScoreDriver;
import com.creditdesk.model.scoring.SmartScoreResult;
import com.creditdesk.model.scoring.Verdict;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pillar-based credit score of a dossier, tolerant to missing data.
 *
 * SCORING MODEL:
 * ==============
 * - Five pillars, each weighted (banque.scoring.weights, 25/25/20/15/15 by default).
 * - A pillar computes a 0-100 raw score from its own rules and earns
 *   round(raw x weight / 100) points.
 * - A pillar without its inputs earns nothing and is left out of the raw-score
 *   average: missing data costs its whole weight, it is never neutral.
 * - Each missing input also carries a severity (blocker / warn / info) and a
 *   penalty subtracted from the total.
 * - score = clamp(sum of points - penalties, 0, 100).
 *
 * VERDICT:
 * ========
 * Any blocker gives "donnees_insuffisantes". Otherwise grade A or B is
 * favorable, C or D favorable with conditions, E unfavorable.
 *
 * Deterministic: same aggregate and profitability give the same result; the
 * only time input is the explicit computedAt.
 */
@Component
public class SmartScoreEngine {

    public static final String ALERT_RULE_PREFIX = "smartscore.";

    private final BanqueProperties.Scoring config;

    public SmartScoreEngine(BanqueProperties properties) {
        this.config = properties.getScoring();
    }

    /**
     * @param profitability base-case profitability of the operation, null when not computed
     */
    public SmartScoreResult score(DossierAggregate aggregate, ProfitabilityResult profitability, Instant computedAt) {
        List<PillarResult> pillars = List.of(
                documentation(aggregate),
                guarantees(aggregate),
                borrower(aggregate),
                project(aggregate),
                financial(aggregate, profitability));

        List<MissingDataItem> missingItems = missingItems(aggregate);
        int totalPenalty = missingItems.stream().mapToInt(MissingDataItem::penalty).sum();
        int earned = pillars.stream().mapToInt(PillarResult::points).sum();
        int score = clamp(earned - totalPenalty);

        List<String> blockers = missingItems.stream()
                .filter(item -> item.severity() == MissingSeverity.BLOCKER)
                .map(MissingDataItem::label)
                .toList();
        Grade grade = grade(score);
        Verdict verdict = verdict(grade, blockers);

        List<ScoreDriver> drivers = drivers(pillars);
        List<ScoreDriver> driversUp = drivers.stream()
                .filter(driver -> driver.delta() > 0)
                .sorted(Comparator.comparingDouble(ScoreDriver::delta).reversed()
                        .thenComparing(driver -> driver.pillar().ordinal()))
                .limit(config.getMaxDrivers())
                .toList();
        List<ScoreDriver> driversDown = drivers.stream()
                .filter(driver -> driver.delta() < 0)
                .sorted(Comparator.comparingDouble(ScoreDriver::delta)
                        .thenComparing(driver -> driver.pillar().ordinal()))
                .limit(config.getMaxDrivers())
                .toList();

        return new SmartScoreResult(
                score,
                grade,
                verdict,
                pillars,
                driversUp,
                driversDown,
                missingItems,
                totalPenalty,
                blockers,
                recommendations(pillars, blockers),
                computedAt);
    }

    public Grade grade(int score) {
        BanqueProperties.Grades cuts = config.getGrades();
        if (score >= cuts.getA()) {
            return Grade.A;
        }
        if (score >= cuts.getB()) {
            return Grade.B;
        }
        if (score >= cuts.getC()) {
            return Grade.C;
        }
        if (score >= cuts.getD()) {
            return Grade.D;
        }
        return Grade.E;
    }

    /**
     * One-paragraph synthesis of a result, used as the report narrative.
     */
    public String verdictExplanation(SmartScoreResult result) {
        StringBuilder text = new StringBuilder(String.format(Locale.ROOT,
                "Score %d/100 (grade %s) : avis %s.",
                result.score(), result.grade(), result.verdict().label().toLowerCase(Locale.FRENCH)));
        if (!result.driversUp().isEmpty()) {
            text.append(" Points forts : ").append(joinLabels(result.driversUp())).append('.');
        }
        if (!result.driversDown().isEmpty()) {
            text.append(" Points faibles : ").append(joinLabels(result.driversDown())).append('.');
        }
        if (!result.blockers().isEmpty()) {
            text.append(" Compléments obligatoires : ").append(String.join(", ", result.blockers())).append('.');
        }
        return text.toString();
    }

    /**
     * Monitoring alerts implied by a result. Ids are stable per dossier and rule,
     * so re-deriving replaces the previous alerts instead of piling up.
     */
    public List<MonitoringAlert> deriveAlerts(SmartScoreResult result, String dossierId, Instant now) {
        List<MonitoringAlert> alerts = new ArrayList<>();
        if (result.verdict() == Verdict.INSUFFICIENT_DATA) {
            alerts.add(alert(dossierId, AlertSeverity.CRITICAL, ALERT_RULE_PREFIX + "blockers",
                    "Données bloquantes manquantes", String.join(", ", result.blockers()), now));
        }
        if (result.grade() == Grade.E) {
            alerts.add(alert(dossierId, AlertSeverity.CRITICAL, ALERT_RULE_PREFIX + "low_score",
                    "Score de risque critique",
                    "SmartScore " + result.score() + "/100, niveau " + RiskLevel.fromScore(result.score()).label(), now));
        }
        for (PillarResult pillar : result.pillars()) {
            if (pillar.hasData() && pillar.rawScore() < 50) {
                String message = pillar.actions().isEmpty() ? pillar.label() : pillar.actions().get(0);
                alerts.add(alert(dossierId, AlertSeverity.WARN, ALERT_RULE_PREFIX + "pillar." + pillar.key().code(),
                        "Pilier faible : " + pillar.label(), message, now));
            }
        }
        return alerts;
    }

    // ==================== PILLARS ====================

    private PillarResult documentation(DossierAggregate aggregate) {
        List<DocumentItem> items = aggregate.documentItems();
        if (items.isEmpty()) {
            return noData(PillarKey.DOCUMENTATION, "Aucun document fourni",
                    "Ajouter les pièces justificatives requises (Kbis, bilans, permis…)");
        }
        List<String> reasons = new ArrayList<>();
        List<String> actions = new ArrayList<>();

        long applicable = items.stream().filter(d -> d.status() != DocumentItem.Status.NOT_APPLICABLE).count();
        long provided = items.stream().filter(d -> d.status() != null && d.status().isProvided()).count();
        long refused = items.stream().filter(d -> d.status() == DocumentItem.Status.REFUSED).count();
        long pending = applicable - provided - refused;

        int raw = applicable == 0 ? 100 : (int) Math.round(provided * 100.0 / applicable);
        if (raw == 100) {
            reasons.add(items.size() + " document(s), tous validés ou reçus");
        } else {
            reasons.add("Complétude " + raw + " % (" + provided + "/" + applicable + " validés/reçus)");
        }
        if (refused > 0) {
            reasons.add(refused + " document(s) refusé(s)");
            actions.add("Corriger et retransmettre les documents refusés");
        }
        if (pending > 0) {
            actions.add("Compléter les documents en attente");
        }
        List<String> missingTypes = aggregate.documents().getMissing();
        if (missingTypes != null && !missingTypes.isEmpty()) {
            raw -= 10 * missingTypes.size();
            reasons.add("Pièces requises manquantes : " + String.join(", ", missingTypes));
            actions.add("Fournir les pièces requises : " + String.join(", ", missingTypes));
        }
        return scored(PillarKey.DOCUMENTATION, raw, reasons, actions);
    }

    private PillarResult guarantees(DossierAggregate aggregate) {
        List<GuaranteeItem> items = aggregate.guaranteeItems();
        if (items.isEmpty()) {
            return noData(PillarKey.GUARANTEES, "Aucune garantie enregistrée",
                    "Constituer au minimum une sûreté réelle (hypothèque) ou personnelle (caution)");
        }
        List<String> reasons = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        Integer ratio = aggregate.coverageRatioPct();
        int full = config.getFullCoveragePct();
        int raw;

        if (ratio == null) {
            raw = 20;
            reasons.add(items.size() + " garantie(s) mais montant du prêt ou valeur non renseigné : ratio incalculable");
            actions.add("Renseigner le montant du prêt et la valeur des garanties");
        } else {
            reasons.add("Ratio garanties/prêt : " + ratio + " %");
            if (ratio >= full) {
                raw = 100;
                reasons.add("Couverture excellente (≥ " + full + " %)");
            } else if (ratio >= 100) {
                raw = 80;
                reasons.add("Couverture suffisante (≥ 100 %)");
            } else if (ratio >= 70) {
                raw = 52;
                reasons.add("Couverture partielle (70-99 %)");
                actions.add("Renforcer les garanties pour atteindre 100 % de couverture");
            } else if (ratio >= 50) {
                raw = 32;
                reasons.add("Couverture faible (50-69 %)");
                actions.add("Garanties complémentaires nécessaires, risque élevé en cas de défaut");
            } else {
                raw = 12;
                reasons.add("Couverture critique (" + ratio + " % < 50 %)");
                actions.add("Exiger des garanties complémentaires avant tout engagement");
            }
        }
        long notObtained = items.stream().filter(g -> g.status() != GuaranteeItem.Status.OBTAINED).count();
        if (notObtained > 0) {
            raw -= 10;
            reasons.add(notObtained + " garantie(s) non encore obtenue(s)");
            actions.add("Obtenir les garanties demandées avant décaissement");
        }
        return scored(PillarKey.GUARANTEES, raw, reasons, actions);
    }

    private PillarResult borrower(DossierAggregate aggregate) {
        Borrower borrower = aggregate.dossier() == null ? null : aggregate.dossier().getBorrower();
        if (borrower == null) {
            return noData(PillarKey.BORROWER, "Emprunteur non renseigné",
                    "Saisir les données d'identification de l'emprunteur");
        }
        List<String> reasons = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        int raw = 0;

        if (borrower instanceof PersonBorrower person) {
            reasons.add("Personne physique");
            if (present(person.firstName()) && present(person.lastName())) {
                raw += 40;
                reasons.add("Identité complète");
            } else {
                actions.add("Compléter prénom et nom");
            }
            if (present(person.email()) || present(person.phone())) {
                raw += 30;
                reasons.add("Coordonnées renseignées");
            } else {
                actions.add("Ajouter email ou téléphone");
            }
            if (present(person.birthDate()) && present(person.address())) {
                raw += 30;
                reasons.add("Informations complémentaires fournies");
            } else {
                actions.add("Compléter date de naissance et adresse");
            }
        } else if (borrower instanceof CompanyBorrower company) {
            reasons.add("Personne morale");
            if (present(company.companyName())) {
                raw += 25;
                reasons.add("Raison sociale renseignée");
            } else {
                actions.add("Saisir la raison sociale");
            }
            if (present(company.sirenSiret())) {
                raw += 25;
                reasons.add("SIREN/SIRET fourni");
            } else {
                actions.add("Fournir le numéro SIREN/SIRET");
            }
            if (present(company.legalForm())) {
                raw += 25;
                reasons.add("Forme juridique : " + company.legalForm());
            } else {
                actions.add("Préciser la forme juridique");
            }
            if (present(company.email()) || present(company.phone())) {
                raw += 25;
                reasons.add("Coordonnées disponibles");
            } else {
                actions.add("Ajouter des coordonnées de contact");
            }
        }
        return scored(PillarKey.BORROWER, raw, reasons, actions);
    }

    private PillarResult project(DossierAggregate aggregate) {
        OriginationSection origination = aggregate.dossier() == null ? null : aggregate.dossier().getOrigination();
        if (origination == null) {
            return noData(PillarKey.PROJECT, "Aucune donnée de projet",
                    "Renseigner les informations du projet (montant, durée, type de prêt)");
        }
        List<String> reasons = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        int raw = 0;

        if (origination.getLoanAmount() != null && origination.getLoanAmount() > 0) {
            raw += 25;
            reasons.add("Montant : " + millions(origination.getLoanAmount()));
        } else {
            actions.add("Renseigner le montant du prêt");
        }
        if (origination.getDurationMonths() != null && origination.getDurationMonths() > 0) {
            raw += 25;
            reasons.add("Durée : " + origination.getDurationMonths() + " mois");
        } else {
            actions.add("Renseigner la durée du prêt");
        }
        OriginationSection.LoanType loanType = origination.getLoanType();
        if (loanType != null && loanType != OriginationSection.LoanType.AUTRE) {
            raw += 25;
            reasons.add("Type : " + loanType.label());
        } else {
            raw += 5;
            reasons.add("Type de prêt non qualifié");
            actions.add("Préciser le type de prêt");
        }
        if (present(origination.getProjectAddress())) {
            raw += 25;
            reasons.add("Adresse projet renseignée");
        } else {
            actions.add("Ajouter l'adresse du projet");
        }

        List<RiskItem> openRisks = aggregate.risks().stream()
                .filter(risk -> risk.status() != RiskItem.Status.MITIGATED)
                .filter(risk -> risk.level() == RiskLevel.HIGH || risk.level() == RiskLevel.CRITICAL)
                .toList();
        if (!openRisks.isEmpty()) {
            raw -= 15 * Math.min(3, openRisks.size());
            reasons.add(openRisks.size() + " risque(s) élevé(s) non mitigé(s)");
            openRisks.forEach(risk -> actions.add("Mitiger le risque : " + risk.label()));
        }

        MarketModule market = aggregate.market();
        if (market != null && market.getDemandIndex() != null && market.getDemandIndex() < 40) {
            raw -= 10;
            reasons.add("Demande locale faible (indice " + market.getDemandIndex() + ")");
            actions.add("Documenter la commercialisation (pré-ventes, étude de marché)");
        }
        return scored(PillarKey.PROJECT, raw, reasons, actions);
    }

    private PillarResult financial(DossierAggregate aggregate, ProfitabilityResult profitability) {
        Dossier dossier = aggregate.dossier();
        OriginationSection origination = dossier == null ? null : dossier.getOrigination();
        double amount = origination == null || origination.getLoanAmount() == null ? 0 : origination.getLoanAmount();
        int duration = origination == null || origination.getDurationMonths() == null ? 0 : origination.getDurationMonths();

        if (amount <= 0 && duration <= 0 && profitability == null) {
            return noData(PillarKey.FINANCIAL, "Données financières absentes", "Renseigner montant et durée");
        }
        List<String> reasons = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        int raw = 100;

        if (amount > config.getLargeLoanAmount() && duration > 0 && duration < 12) {
            raw -= 53;
            reasons.add("Montant élevé (" + millions(amount) + ") avec durée courte (" + duration + " mois)");
            actions.add("Évaluer le risque de tension de trésorerie, envisager un allongement");
        } else if (amount > 0 && duration > 0) {
            reasons.add("Profil montant/durée cohérent");
        }
        if (amount <= 0 || duration <= 0) {
            raw -= 33;
            reasons.add("Données financières incomplètes");
            actions.add("Renseigner montant et durée");
        }

        if (profitability != null) {
            switch (profitability.decision()) {
                case GO -> reasons.add("Rentabilité : GO");
                case GO_WITH_RESERVES -> {
                    raw -= 20;
                    reasons.add("Rentabilité : GO avec réserves");
                    actions.add("Sécuriser la marge (prix de sortie, budget travaux)");
                }
                case NO_GO -> {
                    raw -= 50;
                    reasons.add("Rentabilité : NO GO");
                    actions.add("Revoir le plan de financement ou le prix de sortie");
                }
            }
            double totalCost = profitability.totalCost();
            if (totalCost > 0 && amount > 0) {
                double loanToCost = amount / totalCost * 100;
                reasons.add(String.format(Locale.FRANCE, "LTC : %.1f %%", loanToCost));
                if (loanToCost > config.getMaxLoanToCostPct()) {
                    raw -= 20;
                    actions.add(String.format(Locale.FRANCE, "Augmenter l'apport pour ramener le LTC sous %.0f %%",
                            config.getMaxLoanToCostPct()));
                }
            }
            Double equity = equity(dossier);
            if (equity != null && totalCost > 0 && equity / totalCost * 100 < 10) {
                raw -= 10;
                reasons.add("Apport < 10 % du coût total");
                actions.add("Renforcer l'apport personnel");
            }
        }
        return scored(PillarKey.FINANCIAL, raw, reasons, actions);
    }

    // ==================== MISSING DATA ====================

    private List<MissingDataItem> missingItems(DossierAggregate aggregate) {
        Dossier dossier = aggregate.dossier();
        OriginationSection origination = dossier == null ? null : dossier.getOrigination();
        AnalysisSection analysis = dossier == null ? null : dossier.getAnalysis();
        List<MissingDataItem> items = new ArrayList<>();

        if (origination == null || origination.getLoanAmount() == null || origination.getLoanAmount() <= 0) {
            items.add(missing("origination.loanAmount", "Montant du prêt", MissingSeverity.BLOCKER));
        }
        if (dossier == null || dossier.getBorrower() == null) {
            items.add(missing("borrower", "Identification de l'emprunteur", MissingSeverity.BLOCKER));
        }
        if (analysis == null || analysis.getBudget() == null
                || analysis.getBudget().getPurchasePrice() == null || analysis.getBudget().getPurchasePrice() <= 0) {
            items.add(missing("analysis.budget.purchasePrice", "Prix d'acquisition", MissingSeverity.WARN));
        }
        if (aggregate.guaranteeItems().isEmpty()) {
            items.add(missing("guarantees.items", "Garanties", MissingSeverity.WARN));
        }
        if (aggregate.documentItems().isEmpty()) {
            items.add(missing("documents.items", "Pièces justificatives", MissingSeverity.WARN));
        }
        if (aggregate.market() == null) {
            items.add(missing("market", "Données de marché", MissingSeverity.INFO));
        }
        return items;
    }

    private MissingDataItem missing(String key, String label, MissingSeverity severity) {
        BanqueProperties.Penalties penalties = config.getPenalties();
        int penalty = switch (severity) {
            case BLOCKER -> penalties.getBlocker();
            case WARN -> penalties.getWarn();
            case INFO -> penalties.getInfo();
        };
        return new MissingDataItem(key, label, severity, penalty);
    }

    // ==================== SYNTHESIS ====================

    private Verdict verdict(Grade grade, List<String> blockers) {
        if (!blockers.isEmpty()) {
            return Verdict.INSUFFICIENT_DATA;
        }
        if (grade.compareTo(Grade.B) <= 0) {
            return Verdict.FAVORABLE;
        }
        if (grade.compareTo(Grade.D) <= 0) {
            return Verdict.FAVORABLE_WITH_CONDITIONS;
        }
        return Verdict.UNFAVORABLE;
    }

    /**
     * Delta of each pillar against what it would earn at the average raw score of the scored pillars.
     */
    private List<ScoreDriver> drivers(List<PillarResult> pillars) {
        double averageRaw = pillars.stream()
                .filter(PillarResult::hasData)
                .mapToInt(PillarResult::rawScore)
                .average()
                .orElse(0);
        List<ScoreDriver> drivers = new ArrayList<>();
        for (PillarResult pillar : pillars) {
            double delta = Math.round((pillar.points() - averageRaw * pillar.maxPoints() / 100.0) * 10) / 10.0;
            drivers.add(new ScoreDriver(pillar.key(), pillar.label(), delta, impact(pillar, delta)));
        }
        return drivers;
    }

    private String impact(PillarResult pillar, double delta) {
        if (!pillar.hasData()) {
            return "Données manquantes";
        }
        if (delta < 0 && !pillar.actions().isEmpty()) {
            return pillar.actions().get(0);
        }
        return pillar.reasons().isEmpty() ? pillar.label() : pillar.reasons().get(0);
    }

    /**
     * Blocker follow-ups first, then pillar actions from the weakest pillar, de-duplicated.
     */
    private List<String> recommendations(List<PillarResult> pillars, List<String> blockers) {
        Set<String> recommendations = new LinkedHashSet<>();
        blockers.forEach(blocker -> recommendations.add("Compléter : " + blocker));

        List<PillarResult> weakestFirst = new ArrayList<>(pillars);
        weakestFirst.sort(Comparator.comparingDouble(
                pillar -> pillar.maxPoints() == 0 ? 1.0 : (double) pillar.points() / pillar.maxPoints()));
        weakestFirst.forEach(pillar -> recommendations.addAll(pillar.actions()));

        return recommendations.stream().limit(config.getMaxRecommendations()).toList();
    }

    // ==================== HELPERS ====================

    private PillarResult scored(PillarKey key, int raw, List<String> reasons, List<String> actions) {
        int maxPoints = weight(key);
        int rawScore = clamp(raw);
        int points = (int) Math.round(rawScore * maxPoints / 100.0);
        return new PillarResult(key, key.label(), points, maxPoints, rawScore, true, reasons, actions);
    }

    private PillarResult noData(PillarKey key, String reason, String action) {
        return new PillarResult(key, key.label(), 0, weight(key), 0, false, List.of(reason), List.of(action));
    }

    private int weight(PillarKey key) {
        Integer weight = config.getWeights().get(key.code());
        return weight == null ? 0 : weight;
    }

    private MonitoringAlert alert(String dossierId, AlertSeverity severity, String ruleKey,
                                  String title, String message, Instant now) {
        return MonitoringAlert.builder()
                .id(ruleKey + ":" + dossierId)
                .dossierId(dossierId)
                .severity(severity)
                .ruleKey(ruleKey)
                .title(title)
                .message(message)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static Double equity(Dossier dossier) {
        if (dossier == null || dossier.getAnalysis() == null || dossier.getAnalysis().getBudget() == null) {
            return null;
        }
        return dossier.getAnalysis().getBudget().getEquity();
    }

    private static String joinLabels(List<ScoreDriver> drivers) {
        return drivers.stream().map(ScoreDriver::label).collect(Collectors.joining(", "));
    }

    private static String millions(double amount) {
        return String.format(Locale.FRANCE, "%.2f M€", amount / 1_000_000);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
