package com.creditdesk.model.financial;

/**
 * Profitability classification, ordered from worst to best.
 */
public enum Decision {
    NO_GO,
    GO_WITH_RESERVES,
    GO
}
