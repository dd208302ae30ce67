package com.creditdesk.model.scoring;

import java.time.Instant;
import java.util.List;

public record SmartScoreResult(
        int score,
        Grade grade,
        Verdict verdict,
        List<PillarResult> pillars,
        List<ScoreDriver> driversUp,
        List<ScoreDriver> driversDown,
        List<MissingDataItem> missingItems,
        int totalMissingPenalty,
        List<String> blockers,
        List<String> recommendations,
        Instant computedAt
) {
    public SmartScoreResult {
        pillars = pillars == null ? List.of() : List.copyOf(pillars);
        driversUp = driversUp == null ? List.of() : List.copyOf(driversUp);
        driversDown = driversDown == null ? List.of() : List.copyOf(driversDown);
        missingItems = missingItems == null ? List.of() : List.copyOf(missingItems);
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
