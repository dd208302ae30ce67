package com.creditdesk.model.report;

import com.creditdesk.model.dossier.RiskLevel;
import com.creditdesk.model.financial.Decision;
import com.creditdesk.model.scoring.Grade;
import com.creditdesk.model.scoring.Verdict;

import java.util.List;

/**
 * Synthesised opinion: score verdict, narrative and the follow-ups the committee must obtain.
 */
public record ReportVerdict(
        Verdict verdict,
        String verdictLabel,
        int score,
        Grade grade,
        RiskLevel riskLevel,
        Decision financialDecision,
        String narrative,
        List<String> mandatoryFollowUps
) {
    public ReportVerdict {
        mandatoryFollowUps = mandatoryFollowUps == null ? List.of() : List.copyOf(mandatoryFollowUps);
    }
}
