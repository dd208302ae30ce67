package com.creditdesk.service.audit;

import com.creditdesk.model.ModuleKey;
import com.creditdesk.model.Snapshot;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.module.AlertSeverity;
import com.creditdesk.model.module.CommitteeModule;
import com.creditdesk.model.module.CommitteeVerdict;
import com.creditdesk.model.module.DossierModule;
import com.creditdesk.service.lifecycle.DossierLifecycleStateMachine;
import com.creditdesk.service.store.MonitoringLog;
import com.creditdesk.service.store.SnapshotMutationHook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Appends lifecycle events to the dossier's monitoring log.
 *
 * Monitoring patches are not recorded: the log would otherwise record its own edits.
 */
@Component
@Order(20)
@Slf4j
public class AuditTrailRecorder implements SnapshotMutationHook {

    public static final String RULE_PREFIX = "audit.";
    public static final String DOSSIER_CREATED = RULE_PREFIX + "dossier_created";
    public static final String SECTION_UPDATED = RULE_PREFIX + "section_updated";
    public static final String DECISION_RECORDED = RULE_PREFIX + "decision_recorded";
    public static final String REPORT_GENERATED = RULE_PREFIX + "report_generated";

    @Override
    public void afterDossierUpsert(Snapshot snapshot, Dossier partial, boolean created, Instant now) {
        Dossier dossier = snapshot.getDossier();
        if (!created || dossier == null) {
            return;
        }
        String label = dossier.getLabel() == null ? "" : " - " + dossier.getLabel();
        MonitoringLog.upsert(snapshot, dossier.getId(), MonitoringLog.event(
                dossier.getId(), AlertSeverity.INFO, DOSSIER_CREATED,
                "Dossier créé", "Dossier " + dossier.getReference() + label + " créé", now), now);
    }

    @Override
    public void afterModulePatch(Snapshot snapshot, ModuleKey<?> key, DossierModule patch, Instant now) {
        Dossier dossier = snapshot.getDossier();
        if (key == ModuleKey.MONITORING || dossier == null) {
            return;
        }
        String dossierId = dossier.getId();
        MonitoringLog.upsert(snapshot, dossierId, MonitoringLog.event(
                dossierId, AlertSeverity.INFO, SECTION_UPDATED,
                "Section mise à jour", "Module " + key.name() + " mis à jour", now), now);

        if (key == ModuleKey.COMMITTEE) {
            CommitteeVerdict verdict = ((CommitteeModule) patch).getDecision();
            if (DossierLifecycleStateMachine.isRenderedDecision(verdict)) {
                AlertSeverity severity = verdict == CommitteeVerdict.UNFAVORABLE ? AlertSeverity.WARN : AlertSeverity.INFO;
                MonitoringLog.upsert(snapshot, dossierId, MonitoringLog.event(
                        dossierId, severity, DECISION_RECORDED,
                        "Décision enregistrée", "Avis du comité : " + verdict.label(), now), now);
                log.info("Recorded committee decision {} for dossier {}", verdict, dossierId);
            }
        }
    }
}
