package com.creditdesk.model.report;

import com.creditdesk.model.dossier.RiskLevel;
import com.creditdesk.model.module.RiskItem;

import java.util.List;

public record ReportRiskSection(
        RiskLevel globalLevel,
        Integer globalScore,
        List<Row> items
) {
    public ReportRiskSection {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public record Row(
            String category,
            String label,
            RiskLevel level,
            RiskItem.Status status,
            String mitigation
    ) {
    }
}
