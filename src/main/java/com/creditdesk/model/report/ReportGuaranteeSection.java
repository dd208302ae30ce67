package com.creditdesk.model.report;

import com.creditdesk.model.module.GuaranteeItem;

import java.util.List;

/**
 * @param coverageRatioPct coverage as a whole percentage of the loan amount (120 = 120 %),
 *                         null when the loan amount or the coverage is unknown
 */
public record ReportGuaranteeSection(
        int count,
        double coverage,
        Integer coverageRatioPct,
        List<Row> items,
        List<String> gaps,
        String comment
) {
    public ReportGuaranteeSection {
        items = items == null ? List.of() : List.copyOf(items);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public record Row(
            GuaranteeItem.Type type,
            String description,
            Double value,
            Integer rank,
            GuaranteeItem.Status status
    ) {
    }
}
