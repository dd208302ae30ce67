package com.creditdesk.model.dossier;

import com.creditdesk.model.report.StructuredReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate root for one lending case.
 *
 * Every field is optional so that an instance can also be used as a partial
 * patch for {@code BanqueSnapshotStore.upsertDossier}: null fields are left
 * untouched by the merge.
 *
 * Risks, guarantees, documents, committee and alerts are held in the
 * dossier-scoped modules of the snapshot (see {@code DossierAggregate}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Dossier {

    private String id;
    private String reference;   // e.g. "DOSS-2026-0042"
    private String label;
    private DossierStatus status;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant decisionRenderedAt;

    private Borrower borrower;
    private OriginationSection origination;
    private AnalysisSection analysis;
    private MonitoringSection monitoring;

    private StructuredReport report;
    private Boolean reportGenerated;
}
