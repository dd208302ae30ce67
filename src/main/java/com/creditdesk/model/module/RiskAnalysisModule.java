package com.creditdesk.model.module;

import com.creditdesk.model.dossier.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAnalysisModule implements DossierModule {

    private String dossierId;
    private List<RiskItem> items;
    private RiskLevel globalLevel;
    private Integer globalScore;     // 0-100, higher is safer
    private List<String> sources;
    private String comment;
    private Instant lastComputedAt;
    private Instant updatedAt;

    @Override
    public void afterPatch(DossierModule patch, Instant now) {
        if (((RiskAnalysisModule) patch).getLastComputedAt() == null) {
            lastComputedAt = now;
        }
    }
}
