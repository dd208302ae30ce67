package com.creditdesk.service.lifecycle;

import com.creditdesk.service.store.BanqueSnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The one hard gate of the lifecycle: a screen working on a dossier needs a
 * resolvable dossier id, from navigation first, then from the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DossierGuard {

    private final BanqueSnapshotStore store;

    public DossierResolution resolve(String navigationId) {
        if (navigationId != null && !navigationId.isBlank()) {
            return DossierResolution.proceed(navigationId);
        }
        return store.activeDossierId()
                .map(DossierResolution::proceed)
                .orElseGet(() -> {
                    log.debug("No dossier resolvable, redirecting to dossier selection");
                    return DossierResolution.selectDossier();
                });
    }
}
