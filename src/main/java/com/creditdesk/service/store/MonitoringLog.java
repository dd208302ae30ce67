package com.creditdesk.service.store;

import com.creditdesk.model.Snapshot;
import com.creditdesk.model.module.AlertSeverity;
import com.creditdesk.model.module.MonitoringAlert;
import com.creditdesk.model.module.MonitoringModule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-place edits of the monitoring log of a snapshot. Callers check the dossier guard first.
 */
public final class MonitoringLog {

    private MonitoringLog() {
    }

    public static MonitoringAlert event(String dossierId, AlertSeverity severity, String ruleKey,
                                        String title, String message, Instant now) {
        return MonitoringAlert.builder()
                .id("evt-" + UUID.randomUUID())
                .dossierId(dossierId)
                .severity(severity)
                .ruleKey(ruleKey)
                .title(title)
                .message(message)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Insert the alert, or replace the alert carrying the same id.
     */
    public static void upsert(Snapshot snapshot, String dossierId, MonitoringAlert alert, Instant now) {
        MonitoringModule monitoring = ensure(snapshot, dossierId, now);
        List<MonitoringAlert> alerts = new ArrayList<>(monitoring.getAlerts());
        int index = indexOf(alerts, alert.id());
        if (index >= 0) {
            alerts.set(index, alert);
        } else {
            alerts.add(alert);
        }
        monitoring.setAlerts(alerts);
        monitoring.setUpdatedAt(now);
    }

    /**
     * Re-derived alerts keep the creation and acknowledgement dates of the alert they replace.
     */
    public static List<MonitoringAlert> carryOver(List<MonitoringAlert> derived, List<MonitoringAlert> existing) {
        Map<String, MonitoringAlert> byId = existing.stream()
                .filter(alert -> alert.id() != null)
                .collect(Collectors.toMap(MonitoringAlert::id, Function.identity(), (first, second) -> second));
        return derived.stream()
                .map(alert -> {
                    MonitoringAlert previous = byId.get(alert.id());
                    return previous == null
                            ? alert
                            : alert.withCreatedAt(previous.createdAt()).withAcknowledgedAt(previous.acknowledgedAt());
                })
                .toList();
    }

    public static MonitoringModule ensure(Snapshot snapshot, String dossierId, Instant now) {
        MonitoringModule monitoring = snapshot.getMonitoring();
        if (monitoring == null) {
            monitoring = MonitoringModule.builder()
                    .dossierId(dossierId)
                    .alerts(new ArrayList<>())
                    .rules(new ArrayList<>())
                    .updatedAt(now)
                    .build();
            snapshot.setMonitoring(monitoring);
        }
        if (monitoring.getAlerts() == null) {
            monitoring.setAlerts(new ArrayList<>());
        }
        if (monitoring.getDossierId() == null) {
            monitoring.setDossierId(dossierId);
        }
        return monitoring;
    }

    static int indexOf(List<MonitoringAlert> alerts, String alertId) {
        for (int i = 0; i < alerts.size(); i++) {
            if (alerts.get(i).id() != null && alerts.get(i).id().equals(alertId)) {
                return i;
            }
        }
        return -1;
    }
}
