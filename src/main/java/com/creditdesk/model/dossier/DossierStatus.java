package com.creditdesk.model.dossier;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle status of a lending dossier.
 *
 * The order of declaration is the nominal progression of a dossier.
 * Transitions are advisory: screens for later stages stay reachable.
 */
public enum DossierStatus {
    @JsonProperty("brouillon") BROUILLON,
    @JsonProperty("origination") ORIGINATION,
    @JsonProperty("analyse") ANALYSE,
    @JsonProperty("comite") COMITE,
    @JsonProperty("decision") DECISION,
    @JsonProperty("monitoring") MONITORING,
    @JsonProperty("cloture") CLOTURE
}
