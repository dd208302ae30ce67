package com.creditdesk.service.monitoring;

import java.util.Arrays;
import java.util.Optional;

/**
 * Threshold rules evaluated on every monitoring run. The code is the key of
 * the dossier's {@code MonitoringRule} override.
 */
public enum AlertRuleKey {
    SCORE_BELOW_MIN("score_below_min", "SmartScore bas"),
    SCORE_DROP("score_drop", "Chute SmartScore"),
    DOCS_COMPLETENESS_LOW("docs_completeness_low", "Complétude docs"),
    DOCS_MISSING("docs_missing_critical", "Docs manquants"),
    RISK_LEVEL_HIGH("risk_level_high", "Risque élevé"),
    RISK_UNKNOWN_HIGH("risk_unknown_high", "Risques non évalués"),
    LTV_EXCEEDED("ltv_exceeded", "LTV dépassé"),
    DSCR_LOW("dscr_low", "DSCR faible"),
    NO_SURETES("no_suretes", "Pas de sûretés"),
    COMMITTEE_CONDITIONS_PENDING("comite_conditions_pending", "Conditions suspensives"),
    COMMITTEE_REJECTED("comite_rejected", "Rejet comité"),
    DOSSIER_STALE("dossier_stale", "Dossier inactif"),
    PRE_COMMERCIALISATION_LOW("pre_commercialisation_low", "Pré-commercialisation");

    public static final String RULE_PREFIX = "rules.";

    private final String code;
    private final String label;

    AlertRuleKey(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * Rule key stamped on the alerts this rule raises.
     */
    public String ruleKey() {
        return RULE_PREFIX + code;
    }

    public static Optional<AlertRuleKey> fromCode(String code) {
        return Arrays.stream(values()).filter(key -> key.code.equals(code)).findFirst();
    }
}
