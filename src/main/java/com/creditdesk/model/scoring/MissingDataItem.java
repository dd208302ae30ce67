package com.creditdesk.model.scoring;

/**
 * A required input absent from the dossier, with the penalty it cost.
 *
 * @param key     dotted path of the missing field, e.g. {@code origination.loanAmount}
 * @param penalty points subtracted from the score
 */
public record MissingDataItem(
        String key,
        String label,
        MissingSeverity severity,
        int penalty
) {
}
