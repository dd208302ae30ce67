package com.creditdesk.service.lifecycle;

import com.creditdesk.model.ModuleKey;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.DossierStatus;
import com.creditdesk.model.dossier.OriginationSection;
import com.creditdesk.model.module.CommitteeModule;
import com.creditdesk.model.module.CommitteeVerdict;
import com.creditdesk.service.store.BanqueSnapshotStore;
import com.creditdesk.util.TestDossiers;
import org.junit.jupiter.api.Test;

import static com.creditdesk.util.TestDossiers.DOSSIER_ID;
import static com.creditdesk.util.TestDossiers.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class DossierLifecycleStateMachineTest {

    private final BanqueSnapshotStore store = TestDossiers.store();

    @Test
    void originationSaveMovesDraftForward() {
        store.upsertDossier(Dossier.builder().id(DOSSIER_ID).build());
        assertThat(status()).isEqualTo(DossierStatus.BROUILLON);

        store.upsertDossier(Dossier.builder().id(DOSSIER_ID).origination(TestDossiers.origination()).build());

        assertThat(status()).isEqualTo(DossierStatus.ORIGINATION);
    }

    @Test
    void originationSaveSetsOriginationFromAnyStatus() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.updateStatus(DOSSIER_ID, DossierStatus.ANALYSE);

        store.upsertDossier(Dossier.builder()
                .id(DOSSIER_ID)
                .origination(OriginationSection.builder().notes("Mise à jour").build())
                .build());

        assertThat(status()).isEqualTo(DossierStatus.ORIGINATION);
    }

    @Test
    void saveWithoutOriginationKeepsStatus() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.updateStatus(DOSSIER_ID, DossierStatus.COMITE);

        store.upsertDossier(Dossier.builder().id(DOSSIER_ID).label("Marchand Bordeaux centre").build());

        assertThat(status()).isEqualTo(DossierStatus.COMITE);
    }

    @Test
    void renderedCommitteeVerdictRecordsDecision() {
        store.upsertDossier(TestDossiers.completeDossier());

        store.patchModule(DOSSIER_ID, ModuleKey.COMMITTEE,
                CommitteeModule.builder().decision(CommitteeVerdict.FAVORABLE_WITH_CONDITIONS).build());

        Dossier dossier = store.readActiveDossier().orElseThrow();
        assertThat(dossier.getStatus()).isEqualTo(DossierStatus.DECISION);
        assertThat(dossier.getDecisionRenderedAt()).isEqualTo(NOW);
    }

    @Test
    void pendingVerdictDoesNotRecordDecision() {
        store.upsertDossier(TestDossiers.completeDossier());

        store.patchModule(DOSSIER_ID, ModuleKey.COMMITTEE,
                CommitteeModule.builder().decision(CommitteeVerdict.PENDING).memo("À présenter").build());

        Dossier dossier = store.readActiveDossier().orElseThrow();
        assertThat(dossier.getStatus()).isEqualTo(DossierStatus.ORIGINATION);
        assertThat(dossier.getDecisionRenderedAt()).isNull();
    }

    @Test
    void decisionCanBeRevised() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.patchModule(DOSSIER_ID, ModuleKey.COMMITTEE,
                CommitteeModule.builder().decision(CommitteeVerdict.POSTPONED).build());
        store.updateStatus(DOSSIER_ID, DossierStatus.MONITORING);

        store.patchModule(DOSSIER_ID, ModuleKey.COMMITTEE,
                CommitteeModule.builder().decision(CommitteeVerdict.FAVORABLE).build());

        assertThat(status()).isEqualTo(DossierStatus.DECISION);
        assertThat(store.readModule(ModuleKey.COMMITTEE).orElseThrow().getDecision())
                .isEqualTo(CommitteeVerdict.FAVORABLE);
    }

    @Test
    void renderedDecisionRule() {
        assertThat(DossierLifecycleStateMachine.isRenderedDecision(null)).isFalse();
        assertThat(DossierLifecycleStateMachine.isRenderedDecision(CommitteeVerdict.PENDING)).isFalse();
        assertThat(DossierLifecycleStateMachine.isRenderedDecision(CommitteeVerdict.UNFAVORABLE)).isTrue();
    }

    private DossierStatus status() {
        return store.readActiveDossier().orElseThrow().getStatus();
    }
}
