package com.creditdesk.service.store;

import com.creditdesk.model.ModuleKey;
import com.creditdesk.model.Snapshot;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.module.DossierModule;

import java.time.Instant;

/**
 * Side effect applied by the store inside a mutation, before the snapshot is written.
 *
 * Hooks edit the snapshot in place. They run under the store lock and must not
 * call back into the store.
 */
public interface SnapshotMutationHook {

    /**
     * @param snapshot snapshot holding the merged dossier
     * @param partial  the partial dossier the caller passed
     * @param created  true when the upsert created the dossier (or replaced another one)
     */
    default void afterDossierUpsert(Snapshot snapshot, Dossier partial, boolean created, Instant now) {
    }

    /**
     * @param patch the partial module the caller passed, before merge
     */
    default void afterModulePatch(Snapshot snapshot, ModuleKey<?> key, DossierModule patch, Instant now) {
    }
}
