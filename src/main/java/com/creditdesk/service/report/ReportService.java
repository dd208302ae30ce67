package com.creditdesk.service.report;

import com.creditdesk.model.DossierAggregate;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.financial.ProfitabilityAnalysis;
import com.creditdesk.model.module.AlertSeverity;
import com.creditdesk.model.report.ReportValidity;
import com.creditdesk.model.report.StructuredReport;
import com.creditdesk.model.scoring.SmartScoreResult;
import com.creditdesk.service.audit.AuditTrailRecorder;
import com.creditdesk.service.monitoring.MonitoringAlertService;
import com.creditdesk.service.profitability.ProfitabilityService;
import com.creditdesk.service.report.export.DocumentExporter;
import com.creditdesk.service.report.export.ExportMetadata;
import com.creditdesk.service.report.export.ExportedDocument;
import com.creditdesk.service.scoring.SmartScoreService;
import com.creditdesk.service.store.BanqueSnapshotStore;
import com.creditdesk.service.store.MonitoringLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Generates the committee report of the active dossier and hands valid reports to exporters.
 *
 * GENERATION FLOW:
 * ================
 * 1. Profitability computed and saved into dossier.analysis
 * 2. SmartScore computed and saved into the smartScore module
 * 3. Report assembled from the refreshed snapshot
 * 4. Report attached to the dossier, replacing any previous one
 * 5. "Rapport généré" event appended to the monitoring log
 * 6. Monitoring alert rules run on the refreshed dossier
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private final BanqueSnapshotStore store;
    private final ProfitabilityService profitabilityService;
    private final SmartScoreService smartScoreService;
    private final ReportGenerator reportGenerator;
    private final MonitoringAlertService monitoringAlertService;
    private final Clock clock;

    public StructuredReport generate(String dossierId) {
        ProfitabilityAnalysis profitability = profitabilityService.compute(dossierId);
        SmartScoreResult score = smartScoreService.compute(dossierId);

        Instant now = clock.instant();
        DossierAggregate aggregate = DossierAggregate.from(store.read());
        StructuredReport report = reportGenerator.generate(aggregate, profitability.base(), score, now);

        if (!store.attachReport(dossierId, report)) {
            throw new IllegalStateException("Dossier " + dossierId + " is no longer the active dossier");
        }
        store.upsertAlert(dossierId, MonitoringLog.event(
                dossierId, AlertSeverity.INFO, AuditTrailRecorder.REPORT_GENERATED,
                "Rapport généré",
                "Rapport comité généré (score " + score.score() + "/100, grade " + score.grade() + ")",
                now));
        monitoringAlertService.run(dossierId);

        log.info("Report generated for dossier {}: {} ({}/100)", dossierId, score.verdict(), score.score());
        return report;
    }

    public ReportValidity validity(String dossierId) {
        return ReportValidity.classify(requireActive(dossierId));
    }

    /**
     * @throws IllegalStateException when the dossier has no valid report; regenerate first
     */
    public ExportedDocument export(String dossierId, DocumentExporter exporter) {
        Dossier dossier = requireActive(dossierId);
        ReportValidity validity = ReportValidity.classify(dossier);
        if (validity != ReportValidity.VALID) {
            log.warn("Export refused for dossier {}: report is {}", dossierId, validity);
            throw new IllegalStateException("Report of dossier " + dossierId + " is " + validity);
        }
        return exporter.export(dossier.getReport(), ExportMetadata.of(dossier));
    }

    private Dossier requireActive(String dossierId) {
        return store.readActiveDossier()
                .filter(dossier -> dossier.getId().equals(dossierId))
                .orElseThrow(() -> new IllegalStateException("Dossier " + dossierId + " is not the active dossier"));
    }
}
