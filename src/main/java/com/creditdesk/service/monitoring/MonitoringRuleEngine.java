package com.creditdesk.service.monitoring;

import com.creditdesk.config.BanqueProperties;
import com.creditdesk.model.DossierAggregate;
import com.creditdesk.model.Snapshot;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.RiskLevel;
import com.creditdesk.model.module.AlertSeverity;
import com.creditdesk.model.module.CommitteeModule;
import com.creditdesk.model.module.CommitteeVerdict;
import com.creditdesk.model.module.DocumentsModule;
import com.creditdesk.model.module.GuaranteeItem;
import com.creditdesk.model.module.MonitoringAlert;
import com.creditdesk.model.module.MonitoringRule;
import com.creditdesk.model.module.RiskItem;
import com.creditdesk.model.module.SmartScoreModule;
import com.creditdesk.service.store.MonitoringLog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Evaluates the monitoring alert rules against one dossier.
 *
 * Deterministic: the same snapshot and time give the same alerts. An alert id
 * is {@code rules.<code>:<dossierId>}, so a rule that still fires replaces its
 * previous alert (keeping creation and acknowledgement dates) and a rule that
 * no longer fires drops it.
 *
 * Severities: "critical" findings are CRITICAL, "high" and "medium" ones WARN.
 */
@Component
@RequiredArgsConstructor
public class MonitoringRuleEngine {

    private static final Comparator<MonitoringAlert> MOST_SEVERE_FIRST = Comparator
            .comparing(MonitoringAlert::severity, Comparator.reverseOrder())
            .thenComparing(MonitoringAlert::createdAt);

    private final BanqueProperties properties;

    private record Finding(AlertSeverity severity, String title, String message) {
    }

    /**
     * Every rule with the dossier's override applied: enabled unless switched
     * off, with the override threshold or the configured default.
     */
    public List<MonitoringRule> effectiveRules(List<MonitoringRule> overrides) {
        Map<String, MonitoringRule> byKey = overrides == null ? Map.of() : overrides.stream()
                .filter(rule -> rule.key() != null)
                .collect(Collectors.toMap(MonitoringRule::key, Function.identity(), (first, second) -> second));
        List<MonitoringRule> rules = new ArrayList<>();
        for (AlertRuleKey key : AlertRuleKey.values()) {
            MonitoringRule override = byKey.get(key.code());
            rules.add(MonitoringRule.builder()
                    .key(key.code())
                    .label(key.label())
                    .enabled(override == null || override.enabled() == null || override.enabled())
                    .threshold(override != null && override.threshold() != null
                            ? override.threshold()
                            : defaultThreshold(key))
                    .build());
        }
        return rules;
    }

    public List<MonitoringAlert> evaluate(Snapshot snapshot, Instant now) {
        DossierAggregate aggregate = DossierAggregate.from(snapshot);
        Dossier dossier = aggregate.dossier();
        if (dossier == null) {
            return List.of();
        }
        SmartScoreModule smartScore = snapshot.getSmartScore();
        if (smartScore != null && smartScore.getDossierId() != null && !smartScore.getDossierId().equals(dossier.getId())) {
            smartScore = null;
        }
        List<MonitoringRule> overrides = aggregate.monitoring() == null ? null : aggregate.monitoring().getRules();

        List<MonitoringAlert> alerts = new ArrayList<>();
        for (MonitoringRule rule : effectiveRules(overrides)) {
            if (!rule.enabled()) {
                continue;
            }
            AlertRuleKey key = AlertRuleKey.fromCode(rule.key()).orElseThrow();
            Finding finding = evaluate(key, rule.threshold(), aggregate, smartScore, now);
            if (finding != null) {
                alerts.add(MonitoringAlert.builder()
                        .id(key.ruleKey() + ":" + dossier.getId())
                        .dossierId(dossier.getId())
                        .severity(finding.severity())
                        .title(finding.title())
                        .message(finding.message())
                        .ruleKey(key.ruleKey())
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
            }
        }
        List<MonitoringAlert> sorted = new ArrayList<>(MonitoringLog.carryOver(alerts, aggregate.alerts()));
        sorted.sort(MOST_SEVERE_FIRST);
        return sorted;
    }

    private Finding evaluate(AlertRuleKey key, Double threshold, DossierAggregate aggregate,
                             SmartScoreModule smartScore, Instant now) {
        String name = name(aggregate.dossier());
        return switch (key) {
            case SCORE_BELOW_MIN -> scoreBelowMin(threshold, smartScore, name);
            case SCORE_DROP -> scoreDrop(threshold, smartScore, name);
            case DOCS_COMPLETENESS_LOW -> completenessLow(threshold, aggregate.documents(), name);
            case DOCS_MISSING -> documentsMissing(threshold, aggregate.documents(), name);
            case RISK_LEVEL_HIGH -> riskLevelHigh(aggregate, name);
            case RISK_UNKNOWN_HIGH -> unknownRisks(threshold, aggregate, name);
            case LTV_EXCEEDED -> ltvExceeded(threshold, aggregate.loanToValuePct(), name);
            case DSCR_LOW -> dscrLow(threshold, aggregate.debtServiceCoverage(), name);
            case NO_SURETES -> noSuretes(aggregate, name);
            case COMMITTEE_CONDITIONS_PENDING -> conditionsPending(aggregate.committee(), name);
            case COMMITTEE_REJECTED -> committeeRejected(aggregate.committee(), name);
            case DOSSIER_STALE -> stale(threshold, aggregate.dossier().getUpdatedAt(), now, name);
            case PRE_COMMERCIALISATION_LOW -> preCommercialisationLow(threshold, aggregate.dossier(), name);
        };
    }

    // ==================== SMARTSCORE ====================

    private Finding scoreBelowMin(Double min, SmartScoreModule smartScore, String name) {
        if (smartScore == null || smartScore.getResult() == null) {
            return null;
        }
        int score = smartScore.getResult().score();
        if (score >= min) {
            return null;
        }
        return new Finding(score < 25 ? AlertSeverity.CRITICAL : AlertSeverity.WARN,
                "SmartScore critique",
                "Score " + score + "/100 (seuil : " + number(min) + "). Dossier « " + name
                        + " » nécessite une revue immédiate.");
    }

    private Finding scoreDrop(Double maxDrop, SmartScoreModule smartScore, String name) {
        if (smartScore == null || smartScore.getResult() == null || smartScore.getPreviousScore() == null) {
            return null;
        }
        int current = smartScore.getResult().score();
        int previous = smartScore.getPreviousScore();
        int drop = previous - current;
        if (drop < maxDrop) {
            return null;
        }
        return new Finding(drop >= 25 ? AlertSeverity.CRITICAL : AlertSeverity.WARN,
                "Chute du SmartScore",
                "Score passé de " + previous + " à " + current + " (-" + drop + " pts) pour « " + name + " ».");
    }

    // ==================== DOCUMENTS ====================

    private Finding completenessLow(Double min, DocumentsModule documents, String name) {
        if (documents == null || documents.getCompletenessPct() == null) {
            return null;
        }
        int pct = documents.getCompletenessPct();
        if (pct >= min) {
            return null;
        }
        return new Finding(AlertSeverity.WARN,
                "Complétude documentaire insuffisante",
                pct + "% de documents fournis (min : " + number(min) + "%) pour « " + name + " ».");
    }

    private Finding documentsMissing(Double max, DocumentsModule documents, String name) {
        List<String> missing = documents == null || documents.getMissing() == null ? List.of() : documents.getMissing();
        if (missing.size() <= max) {
            return null;
        }
        String listed = String.join(", ", missing.subList(0, Math.min(3, missing.size())))
                + (missing.size() > 3 ? "…" : "");
        return new Finding(AlertSeverity.WARN,
                "Documents obligatoires manquants",
                missing.size() + " doc(s) manquant(s) : " + listed + " pour « " + name + " ».");
    }

    // ==================== RISKS ====================

    private Finding riskLevelHigh(DossierAggregate aggregate, String name) {
        RiskLevel level = aggregate.riskAnalysis() == null ? null : aggregate.riskAnalysis().getGlobalLevel();
        if (level != RiskLevel.HIGH && level != RiskLevel.CRITICAL) {
            return null;
        }
        String label = level.label().toLowerCase(Locale.ROOT);
        long present = aggregate.risks().stream().filter(risk -> risk.status() == RiskItem.Status.PRESENT).count();
        return new Finding(level == RiskLevel.CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.WARN,
                "Niveau de risque " + label,
                "Analyse de risques : niveau global « " + label + " » (" + present
                        + " risque(s) identifié(s)) pour « " + name + " ».");
    }

    private Finding unknownRisks(Double max, DossierAggregate aggregate, String name) {
        long unknown = aggregate.risks().stream().filter(risk -> risk.status() == RiskItem.Status.UNKNOWN).count();
        if (unknown < max) {
            return null;
        }
        return new Finding(AlertSeverity.WARN,
                "Risques non évalués",
                unknown + " risque(s) non évalué(s) pour « " + name + " ». Analyse incomplète.");
    }

    // ==================== GUARANTEES ====================

    private Finding ltvExceeded(Double max, Double ltv, String name) {
        if (ltv == null || ltv <= max) {
            return null;
        }
        return new Finding(ltv > 90 ? AlertSeverity.CRITICAL : AlertSeverity.WARN,
                "LTV dépassé",
                String.format(Locale.ROOT, "LTV à %.1f%% (max : %s%%) pour « %s ».", ltv, number(max), name));
    }

    private Finding dscrLow(Double min, Double dscr, String name) {
        if (dscr == null || dscr >= min) {
            return null;
        }
        return new Finding(dscr < 1.0 ? AlertSeverity.CRITICAL : AlertSeverity.WARN,
                "DSCR insuffisant",
                String.format(Locale.ROOT, "DSCR à %.2f (min : %s) pour « %s ». Capacité de remboursement fragile.",
                        dscr, number(min), name));
    }

    private Finding noSuretes(DossierAggregate aggregate, String name) {
        // Only judged once the financing is known
        if (aggregate.loanToValuePct() == null && aggregate.debtServiceCoverage() == null) {
            return null;
        }
        boolean secured = aggregate.guaranteeItems().stream()
                .anyMatch(item -> item.status() == GuaranteeItem.Status.OBTAINED);
        if (secured) {
            return null;
        }
        return new Finding(AlertSeverity.WARN,
                "Aucune sûreté constituée",
                "Dossier « " + name + " » : aucune garantie obtenue.");
    }

    // ==================== COMMITTEE ====================

    private Finding conditionsPending(CommitteeModule committee, String name) {
        if (committee == null || committee.getDecision() != CommitteeVerdict.FAVORABLE_WITH_CONDITIONS
                || committee.getConditions() == null || committee.getConditions().isEmpty()) {
            return null;
        }
        return new Finding(AlertSeverity.WARN,
                "Conditions suspensives en attente",
                committee.getConditions().size() + " condition(s) à lever pour « " + name + " ».");
    }

    private Finding committeeRejected(CommitteeModule committee, String name) {
        if (committee == null || committee.getDecision() != CommitteeVerdict.UNFAVORABLE) {
            return null;
        }
        return new Finding(AlertSeverity.CRITICAL,
                "Dossier rejeté par le comité",
                "Le comité a rejeté le dossier « " + name + " ». Action corrective requise.");
    }

    // ==================== FOLLOW-UP ====================

    private Finding stale(Double maxDays, Instant updatedAt, Instant now, String name) {
        if (updatedAt == null) {
            return null;
        }
        double days = Duration.between(updatedAt, now).toMillis() / 86_400_000.0;
        if (days < maxDays) {
            return null;
        }
        return new Finding(AlertSeverity.WARN,
                "Dossier sans mise à jour",
                "Dossier « " + name + " » non mis à jour depuis " + Math.round(days)
                        + " jours (seuil : " + number(maxDays) + " j).");
    }

    private Finding preCommercialisationLow(Double min, Dossier dossier, String name) {
        Double pct = dossier.getMonitoring() == null ? null : dossier.getMonitoring().getPreCommercialisationPct();
        if (pct == null || pct >= min) {
            return null;
        }
        return new Finding(AlertSeverity.WARN,
                "Pré-commercialisation faible",
                number(pct) + "% de pré-commercialisation (min attendu : " + number(min) + "%) pour « " + name + " ».");
    }

    // ==================== HELPERS ====================

    private Double defaultThreshold(AlertRuleKey key) {
        BanqueProperties.Alerts alerts = properties.getAlerts();
        return switch (key) {
            case SCORE_BELOW_MIN -> alerts.getScoreMin();
            case SCORE_DROP -> alerts.getScoreDrop();
            case DOCS_COMPLETENESS_LOW -> alerts.getCompletenessMin();
            case DOCS_MISSING -> alerts.getMissingDocsMax();
            case RISK_UNKNOWN_HIGH -> alerts.getUnknownRisksMax();
            case LTV_EXCEEDED -> alerts.getLtvMax();
            case DSCR_LOW -> alerts.getDscrMin();
            case DOSSIER_STALE -> alerts.getStaleAfterDays();
            case PRE_COMMERCIALISATION_LOW -> alerts.getPreCommercialisationMin();
            case RISK_LEVEL_HIGH, NO_SURETES, COMMITTEE_CONDITIONS_PENDING, COMMITTEE_REJECTED -> null;
        };
    }

    private static String name(Dossier dossier) {
        if (dossier.getLabel() != null && !dossier.getLabel().isBlank()) {
            return dossier.getLabel();
        }
        return dossier.getReference() != null ? dossier.getReference() : dossier.getId();
    }

    // 40.0 -> "40", 1.2 -> "1.2"
    private static String number(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
