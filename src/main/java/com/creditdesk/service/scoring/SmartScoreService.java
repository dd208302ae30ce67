package com.creditdesk.service.scoring;

import com.creditdesk.model.DossierAggregate;
import com.creditdesk.model.ModuleKey;
import com.creditdesk.model.Snapshot;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.financial.ProfitabilityResult;
import com.creditdesk.model.module.SmartScoreModule;
import com.creditdesk.model.scoring.SmartScoreResult;
import com.creditdesk.service.store.BanqueSnapshotStore;
import com.creditdesk.service.store.MonitoringLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Scores the active dossier, saves the result in the smartScore module and
 * refreshes the SmartScore-driven monitoring alerts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SmartScoreService {

    private final BanqueSnapshotStore store;
    private final SmartScoreEngine engine;
    private final Clock clock;

    public SmartScoreResult compute(String dossierId) {
        Snapshot snapshot = store.read();
        Dossier dossier = snapshot.getDossier();
        if (dossier == null || !dossier.getId().equals(dossierId)) {
            throw new IllegalStateException("Dossier " + dossierId + " is not the active dossier");
        }
        Instant now = clock.instant();
        DossierAggregate aggregate = DossierAggregate.from(snapshot);
        SmartScoreResult result = engine.score(aggregate, baseProfitability(dossier), now);

        SmartScoreModule previous = snapshot.getSmartScore();
        store.patchModule(dossierId, ModuleKey.SMART_SCORE, SmartScoreModule.builder()
                .dossierId(dossierId)
                .result(result)
                .previousScore(previous == null || previous.getResult() == null
                        || !dossierId.equals(previous.getDossierId()) ? null : previous.getResult().score())
                .build());
        store.replaceAlerts(dossierId, SmartScoreEngine.ALERT_RULE_PREFIX,
                MonitoringLog.carryOver(engine.deriveAlerts(result, dossierId, now), aggregate.alerts()));

        log.info("SmartScore for dossier {}: {}/100 grade {} ({})",
                dossierId, result.score(), result.grade(), result.verdict());
        return result;
    }

    private static ProfitabilityResult baseProfitability(Dossier dossier) {
        if (dossier.getAnalysis() == null || dossier.getAnalysis().getProfitability() == null) {
            return null;
        }
        return dossier.getAnalysis().getProfitability().base();
    }
}
