package com.creditdesk.model.report;

import com.creditdesk.model.dossier.Dossier;

/**
 * State of the report attached to a dossier.
 *
 * {@link #INVALID} covers a report flagged as generated but absent, and a
 * report missing its generation timestamp or meta block. Callers offer
 * regeneration in that case rather than trusting the flag.
 */
public enum ReportValidity {
    NOT_GENERATED,
    VALID,
    INVALID;

    public static ReportValidity classify(Dossier dossier) {
        if (dossier == null) {
            return NOT_GENERATED;
        }
        StructuredReport report = dossier.getReport();
        if (report == null) {
            return Boolean.TRUE.equals(dossier.getReportGenerated()) ? INVALID : NOT_GENERATED;
        }
        return classify(report);
    }

    public static ReportValidity classify(StructuredReport report) {
        if (report == null) {
            return NOT_GENERATED;
        }
        ReportMeta meta = report.meta();
        boolean metaPopulated = meta != null && meta.dossierId() != null && !meta.dossierId().isBlank();
        return report.generatedAt() != null && metaPopulated ? VALID : INVALID;
    }
}
