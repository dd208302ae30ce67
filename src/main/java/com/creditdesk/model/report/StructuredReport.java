package com.creditdesk.model.report;

import com.creditdesk.model.financial.ProfitabilityResult;
import com.creditdesk.model.scoring.SmartScoreResult;

import java.time.Instant;

/**
 * Frozen decision artifact presented to the credit committee.
 *
 * Created only by the report generator; regeneration supersedes it,
 * nothing edits it. A report without {@code generatedAt} or {@code meta}
 * is not valid (see {@code ReportValidity}).
 */
public record StructuredReport(
        Instant generatedAt,
        ReportMeta meta,
        ReportBorrower borrower,
        ReportProject project,
        ReportTable budget,
        ReportTable financing,
        ReportTable revenue,
        ReportTable market,
        ReportRiskSection risks,
        ReportGuaranteeSection guarantees,
        ReportDocumentSection documents,
        ProfitabilityResult profitability,
        SmartScoreResult smartScore,
        ReportVerdict verdict,
        CommitteeOutlook committee
) {
}
