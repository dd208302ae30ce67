package com.creditdesk.service.lifecycle;

import com.creditdesk.model.ModuleKey;
import com.creditdesk.model.Snapshot;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.DossierStatus;
import com.creditdesk.model.module.CommitteeModule;
import com.creditdesk.model.module.CommitteeVerdict;
import com.creditdesk.model.module.DossierModule;
import com.creditdesk.service.store.SnapshotMutationHook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Status transitions driven by section saves.
 *
 * brouillon -> origination -> analyse -> comite -> decision -> monitoring -> cloture
 *
 * The machine is advisory: later screens stay reachable without the earlier
 * stages, there is no terminal lock, committee decisions may be revised and
 * {@code updateStatus} may set any status. Two saves move the status:
 * - saving origination data sets "origination", whatever the current status;
 * - a committee patch with a rendered verdict moves the dossier to "decision"
 *   and stamps the decision timestamp, every time it is saved.
 */
@Component
@Order(10)
@Slf4j
public class DossierLifecycleStateMachine implements SnapshotMutationHook {

    @Override
    public void afterDossierUpsert(Snapshot snapshot, Dossier partial, boolean created, Instant now) {
        Dossier dossier = snapshot.getDossier();
        if (dossier == null || partial.getOrigination() == null) {
            return;
        }
        if (dossier.getStatus() != DossierStatus.ORIGINATION) {
            log.info("Dossier {} status {} -> {} (origination saved)",
                    dossier.getId(), dossier.getStatus(), DossierStatus.ORIGINATION);
            dossier.setStatus(DossierStatus.ORIGINATION);
        }
    }

    @Override
    public void afterModulePatch(Snapshot snapshot, ModuleKey<?> key, DossierModule patch, Instant now) {
        if (key != ModuleKey.COMMITTEE || snapshot.getDossier() == null) {
            return;
        }
        CommitteeVerdict verdict = ((CommitteeModule) patch).getDecision();
        if (!isRenderedDecision(verdict)) {
            return;
        }
        Dossier dossier = snapshot.getDossier();
        log.info("Dossier {} status {} -> {} (committee verdict {})",
                dossier.getId(), dossier.getStatus(), DossierStatus.DECISION, verdict);
        dossier.setStatus(DossierStatus.DECISION);
        dossier.setDecisionRenderedAt(now);
        dossier.setUpdatedAt(now);
    }

    public static boolean isRenderedDecision(CommitteeVerdict verdict) {
        return verdict != null && verdict.rendered();
    }
}
