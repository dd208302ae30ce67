package com.creditdesk.model.scoring;

import java.util.List;

/**
 * Outcome of one pillar.
 *
 * @param rawScore 0-100 sub-score from the pillar's own rules
 * @param points   earned points, {@code round(rawScore * maxPoints / 100)}, 0 without data
 */
public record PillarResult(
        PillarKey key,
        String label,
        int points,
        int maxPoints,
        int rawScore,
        boolean hasData,
        List<String> reasons,
        List<String> actions
) {
    public PillarResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
