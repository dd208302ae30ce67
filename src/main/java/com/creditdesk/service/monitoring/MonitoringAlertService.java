package com.creditdesk.service.monitoring;

import com.creditdesk.model.Snapshot;
import com.creditdesk.model.module.AlertSeverity;
import com.creditdesk.model.module.MonitoringAlert;
import com.creditdesk.model.module.MonitoringModule;
import com.creditdesk.model.module.MonitoringRule;
import com.creditdesk.service.store.BanqueSnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Runs the monitoring alert rules on the active dossier and keeps the
 * dossier's rule overrides.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringAlertService {

    private final BanqueSnapshotStore store;
    private final MonitoringRuleEngine engine;
    private final Clock clock;

    /**
     * Evaluate every enabled rule and replace the rule-driven alerts of the log.
     * Lifecycle events and SmartScore alerts are kept.
     */
    public List<MonitoringAlert> run(String dossierId) {
        Snapshot snapshot = requireActive(dossierId);
        List<MonitoringAlert> alerts = engine.evaluate(snapshot, clock.instant());
        if (!store.replaceAlerts(dossierId, AlertRuleKey.RULE_PREFIX, alerts)) {
            throw new IllegalStateException("Dossier " + dossierId + " is no longer the active dossier");
        }
        long critical = alerts.stream().filter(alert -> alert.severity() == AlertSeverity.CRITICAL).count();
        log.info("Monitoring run for dossier {}: {} alert(s), {} critical", dossierId, alerts.size(), critical);
        return alerts;
    }

    public List<MonitoringRule> rules(String dossierId) {
        MonitoringModule monitoring = requireActive(dossierId).getMonitoring();
        boolean scoped = monitoring != null && dossierId.equals(monitoring.getDossierId());
        return engine.effectiveRules(scoped ? monitoring.getRules() : null);
    }

    /**
     * @throws IllegalArgumentException when a rule key is unknown
     */
    public void updateRules(String dossierId, List<MonitoringRule> rules) {
        for (MonitoringRule rule : rules) {
            if (AlertRuleKey.fromCode(rule.key()).isEmpty()) {
                throw new IllegalArgumentException("Unknown monitoring rule: " + rule.key());
            }
        }
        if (!store.patchMonitoringRules(dossierId, rules)) {
            throw new IllegalStateException("Dossier " + dossierId + " is not the active dossier");
        }
        log.info("Monitoring rules updated for dossier {}: {} override(s)", dossierId, rules.size());
    }

    private Snapshot requireActive(String dossierId) {
        Snapshot snapshot = store.read();
        if (snapshot.getDossier() == null || !snapshot.getDossier().getId().equals(dossierId)) {
            throw new IllegalStateException("Dossier " + dossierId + " is not the active dossier");
        }
        return snapshot;
    }
}
