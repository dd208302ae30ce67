package com.creditdesk.model.module;

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
public class MonitoringModule implements DossierModule {

    private String dossierId;
    private List<MonitoringAlert> alerts;
    private List<MonitoringRule> rules;
    private Instant lastRunAt;
    private Instant updatedAt;
}
