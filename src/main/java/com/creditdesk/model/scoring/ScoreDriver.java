package com.creditdesk.model.scoring;

/**
 * A pillar pulling the score up or down.
 *
 * @param delta earned points above (positive) or below (negative) what the pillar
 *              would earn at the average raw score of the scored pillars
 */
public record ScoreDriver(
        PillarKey pillar,
        String label,
        double delta,
        String impact
) {
}
