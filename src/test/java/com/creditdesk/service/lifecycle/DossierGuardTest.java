package com.creditdesk.service.lifecycle;

import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.service.store.BanqueSnapshotStore;
import com.creditdesk.util.TestDossiers;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DossierGuardTest {

    private final BanqueSnapshotStore store = TestDossiers.store();
    private final DossierGuard guard = new DossierGuard(store);

    @Test
    void navigationIdWins() {
        store.upsertDossier(Dossier.builder().id("dos-active").build());

        DossierResolution resolution = guard.resolve("dos-from-url");

        assertThat(resolution.proceeding()).isTrue();
        assertThat(resolution.dossierId()).isEqualTo("dos-from-url");
    }

    @Test
    void fallsBackToActiveDossier() {
        store.upsertDossier(Dossier.builder().id("dos-active").build());

        assertThat(guard.resolve(" ")).isEqualTo(DossierResolution.proceed("dos-active"));
        assertThat(guard.resolve(null)).isEqualTo(DossierResolution.proceed("dos-active"));
    }

    @Test
    void redirectsToSelectionWhenNothingResolves() {
        DossierResolution resolution = guard.resolve(null);

        assertThat(resolution.proceeding()).isFalse();
        assertThat(resolution.outcome()).isEqualTo(DossierResolution.Outcome.SELECT_DOSSIER);
        assertThat(resolution.dossierId()).isNull();
    }

    @Test
    void proceedingRequiresAnId() {
        assertThatThrownBy(() -> DossierResolution.proceed(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
