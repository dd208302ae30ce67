package com.creditdesk.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Borrower identity block. {@code details} keeps the display order of the labels.
 */
public record ReportBorrower(
        Kind kind,
        String identity,
        Map<String, String> details
) {
    public ReportBorrower {
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public enum Kind {
        @JsonProperty("personne_physique") PERSON,
        @JsonProperty("personne_morale") COMPANY,
        @JsonProperty("inconnu") UNKNOWN
    }
}
