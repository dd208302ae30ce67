package com.creditdesk.model;

import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.module.CommitteeModule;
import com.creditdesk.model.module.DocumentsModule;
import com.creditdesk.model.module.GuaranteesModule;
import com.creditdesk.model.module.MarketModule;
import com.creditdesk.model.module.MonitoringModule;
import com.creditdesk.model.module.RiskAnalysisModule;
import com.creditdesk.model.module.SmartScoreModule;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Versioned persisted state of the Banque vertical: one active dossier plus
 * its auxiliary modules. An absent module means "not yet computed".
 */
@Data
@NoArgsConstructor
public class Snapshot {

    public static final int CURRENT_VERSION = 1;

    private Integer version;
    private Instant updatedAt;

    private Dossier dossier;
    private String activeDossierId;

    private RiskAnalysisModule riskAnalysis;
    private GuaranteesModule guarantees;
    private DocumentsModule documents;
    private CommitteeModule committee;
    private MonitoringModule monitoring;
    private SmartScoreModule smartScore;
    private MarketModule market;

    public static Snapshot empty(Instant now) {
        Snapshot snapshot = new Snapshot();
        snapshot.setVersion(CURRENT_VERSION);
        snapshot.setUpdatedAt(now);
        return snapshot;
    }

    /**
     * Id of the active dossier, falling back to the embedded dossier's id.
     */
    public String resolveActiveDossierId() {
        if (activeDossierId != null) {
            return activeDossierId;
        }
        return dossier != null ? dossier.getId() : null;
    }
}
