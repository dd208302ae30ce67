package com.creditdesk.model.report;

import java.util.List;

public record ReportTable(
        String title,
        List<ReportRow> rows
) {
    public ReportTable {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
