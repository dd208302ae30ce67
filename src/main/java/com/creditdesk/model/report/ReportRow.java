package com.creditdesk.model.report;

/**
 * One line of a report table: either a numeric value with its unit, or a text value.
 */
public record ReportRow(
        String label,
        Double value,
        String unit,
        String text
) {
    public static ReportRow amount(String label, Double value) {
        return new ReportRow(label, value, "EUR", null);
    }

    public static ReportRow percent(String label, Double value) {
        return new ReportRow(label, value, "%", null);
    }

    public static ReportRow number(String label, Double value, String unit) {
        return new ReportRow(label, value, unit, null);
    }

    public static ReportRow text(String label, String text) {
        return new ReportRow(label, null, null, text);
    }
}
