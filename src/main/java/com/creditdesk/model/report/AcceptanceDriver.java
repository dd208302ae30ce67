package com.creditdesk.model.report;

/**
 * One factor of the acceptance probability.
 *
 * @param impact points added to (or taken from) the probability
 */
public record AcceptanceDriver(
        String label,
        String detail,
        int impact
) {
}
