package com.creditdesk.model.module;

import java.time.Instant;

/**
 * An auxiliary snapshot module scoped to the active dossier.
 */
public interface DossierModule {

    String getDossierId();

    void setDossierId(String dossierId);

    Instant getUpdatedAt();

    void setUpdatedAt(Instant updatedAt);

    /**
     * Recompute derived fields once a patch has been merged into this module.
     *
     * @param patch the partial module that was merged
     * @param now   timestamp of the mutation
     */
    default void afterPatch(DossierModule patch, Instant now) {
    }
}
