package com.creditdesk.service.report.export;

import com.creditdesk.model.report.StructuredReport;

/**
 * Renders a valid committee report into a downloadable artifact.
 * Implementations never modify the report.
 */
public interface DocumentExporter {

    ExportedDocument export(StructuredReport report, ExportMetadata metadata);
}
