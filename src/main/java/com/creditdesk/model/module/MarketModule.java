package com.creditdesk.model.module;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Local market figures (DVF / INSEE based).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketModule implements DossierModule {

    private String dossierId;
    private String commune;
    private Double pricePerSqm;
    private Integer demandIndex;       // 0-100
    private Integer compsCount;
    private Double absorptionMonths;
    private Double evolutionPct;
    private List<String> sources;
    private String comment;
    private Instant updatedAt;
}
