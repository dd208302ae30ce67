package com.creditdesk.model.report;

import java.util.List;

/**
 * Estimated chance, 0-100, that the committee accepts the dossier, with its
 * drivers sorted by decreasing absolute impact.
 */
public record AcceptanceProbability(
        int score,
        List<AcceptanceDriver> drivers
) {
    public AcceptanceProbability {
        drivers = drivers == null ? List.of() : List.copyOf(drivers);
    }
}
