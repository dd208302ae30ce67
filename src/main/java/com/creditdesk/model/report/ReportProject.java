package com.creditdesk.model.report;

public record ReportProject(
        Double loanAmount,
        Integer durationMonths,
        String loanType,
        String loanTypeLabel,
        String projectType,
        String address,
        String notes
) {
}
