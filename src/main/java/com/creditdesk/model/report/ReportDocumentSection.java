package com.creditdesk.model.report;

import com.creditdesk.model.module.DocumentItem;

import java.util.List;

public record ReportDocumentSection(
        int total,
        int completenessPct,
        List<Row> items,
        List<String> missing
) {
    public ReportDocumentSection {
        items = items == null ? List.of() : List.copyOf(items);
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public record Row(
            String name,
            String type,
            DocumentItem.Status status,
            String comment
    ) {
    }
}
