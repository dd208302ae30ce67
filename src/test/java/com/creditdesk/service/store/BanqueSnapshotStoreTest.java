package com.creditdesk.service.store;

import com.creditdesk.model.ModuleKey;
import com.creditdesk.model.Snapshot;
import com.creditdesk.model.dossier.CompanyBorrower;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.DossierStatus;
import com.creditdesk.model.dossier.OriginationSection;
import com.creditdesk.model.module.AlertSeverity;
import com.creditdesk.model.module.DocumentItem;
import com.creditdesk.model.module.DocumentsModule;
import com.creditdesk.model.module.GuaranteeItem;
import com.creditdesk.model.module.GuaranteesModule;
import com.creditdesk.model.module.MonitoringAlert;
import com.creditdesk.model.module.MonitoringRule;
import com.creditdesk.model.report.ReportMeta;
import com.creditdesk.model.report.StructuredReport;
import com.creditdesk.repository.InMemorySnapshotBackend;
import com.creditdesk.repository.SnapshotBackend;
import com.creditdesk.repository.SnapshotPersistenceException;
import com.creditdesk.util.TestDossiers;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.creditdesk.util.TestDossiers.DOSSIER_ID;
import static com.creditdesk.util.TestDossiers.KEY;
import static com.creditdesk.util.TestDossiers.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BanqueSnapshotStoreTest {

    private final InMemorySnapshotBackend backend = new InMemorySnapshotBackend();
    private final BanqueSnapshotStore store = TestDossiers.store(backend, new InProcessSnapshotChangeRelay());

    @Test
    void emptyBackendReadsAsEmptyVersionedSnapshot() {
        Snapshot snapshot = store.read();

        assertThat(snapshot.getVersion()).isEqualTo(Snapshot.CURRENT_VERSION);
        assertThat(snapshot.getDossier()).isNull();
        assertThat(store.activeDossierId()).isEmpty();
    }

    @Test
    void creationAppliesDefaultsAndActivatesDossier() {
        Dossier written = store.upsertDossier(Dossier.builder().id(DOSSIER_ID).label("Test").build());

        assertThat(written.getCreatedAt()).isEqualTo(NOW);
        assertThat(written.getUpdatedAt()).isEqualTo(NOW);
        assertThat(written.getStatus()).isEqualTo(DossierStatus.BROUILLON);
        assertThat(written.getReference()).isEqualTo("DOSS-2026-DOSABC");
        assertThat(store.activeDossierId()).contains(DOSSIER_ID);
        assertThat(store.read().getActiveDossierId()).isEqualTo(DOSSIER_ID);
    }

    @Test
    void upsertWithoutIdIsRejected() {
        assertThatThrownBy(() -> store.upsertDossier(Dossier.builder().label("Sans id").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(backend.load(KEY)).isEmpty();
    }

    @Test
    void partialUpsertPreservesSiblingSections() {
        store.upsertDossier(TestDossiers.completeDossier());

        store.upsertDossier(Dossier.builder()
                .id(DOSSIER_ID)
                .origination(OriginationSection.builder().loanAmount(250_000.0).build())
                .build());

        Dossier dossier = store.readActiveDossier().orElseThrow();
        assertThat(dossier.getOrigination().getLoanAmount()).isEqualTo(250_000.0);
        assertThat(dossier.getOrigination().getDurationMonths()).isEqualTo(24);
        assertThat(dossier.getOrigination().getProjectAddress()).isEqualTo("8 rue Victor Hugo, Bordeaux");
        assertThat(dossier.getAnalysis().getBudget()).isEqualTo(TestDossiers.budget());
        assertThat(dossier.getBorrower()).isEqualTo(TestDossiers.person());
        assertThat(dossier.getLabel()).isEqualTo("Marchand Bordeaux");
    }

    @Test
    void borrowerOfAnotherTypeReplacesTheOldOne() {
        store.upsertDossier(TestDossiers.completeDossier());

        store.upsertDossier(Dossier.builder().id(DOSSIER_ID).borrower(TestDossiers.company()).build());

        // No field of the person (phone) leaks into the company
        assertThat(store.readActiveDossier().orElseThrow().getBorrower())
                .isInstanceOf(CompanyBorrower.class)
                .isEqualTo(TestDossiers.company());
    }

    @Test
    void switchingDossierDropsPreviousModules() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.patchModule(DOSSIER_ID, ModuleKey.GUARANTEES,
                TestDossiers.guarantees(200_000, GuaranteeItem.Status.OBTAINED));

        store.upsertDossier(Dossier.builder().id("dos-other").build());

        Snapshot snapshot = store.read();
        assertThat(snapshot.getDossier().getId()).isEqualTo("dos-other");
        assertThat(snapshot.getDossier().getOrigination()).isNull();
        assertThat(snapshot.getGuarantees()).isNull();
        assertThat(snapshot.getMonitoring().getDossierId()).isEqualTo("dos-other");
    }

    @Test
    void patchOnNonActiveDossierLeavesPayloadUntouched() {
        store.upsertDossier(TestDossiers.completeDossier());
        String before = backend.load(KEY).orElseThrow();

        boolean patched = store.patchModule("dos-stale", ModuleKey.GUARANTEES,
                TestDossiers.guarantees(100_000, GuaranteeItem.Status.OBTAINED));

        assertThat(patched).isFalse();
        assertThat(backend.load(KEY)).contains(before);
        assertThat(store.updateStatus("dos-stale", DossierStatus.COMITE)).isFalse();
        assertThat(store.upsertAlert("dos-stale", alert("a1", "manual.check"))).isFalse();
        assertThat(backend.load(KEY)).contains(before);
    }

    @Test
    void patchCarryingAnotherDossierIdIsRejected() {
        store.upsertDossier(TestDossiers.completeDossier());
        GuaranteesModule patch = TestDossiers.guarantees(100_000, GuaranteeItem.Status.OBTAINED);
        patch.setDossierId("dos-other");

        assertThat(store.patchModule(DOSSIER_ID, ModuleKey.GUARANTEES, patch)).isFalse();
        assertThat(store.read().getGuarantees()).isNull();
    }

    @Test
    void patchWithoutActiveDossierIsRejected() {
        assertThat(store.patchModule(DOSSIER_ID, ModuleKey.GUARANTEES,
                TestDossiers.guarantees(100_000, GuaranteeItem.Status.OBTAINED))).isFalse();
        assertThat(backend.load(KEY)).isEmpty();
    }

    @Test
    void modulePatchIsShallowAndStamped() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.patchModule(DOSSIER_ID, ModuleKey.GUARANTEES,
                TestDossiers.guarantees(150_000, GuaranteeItem.Status.REQUESTED));

        store.patchModule(DOSSIER_ID, ModuleKey.GUARANTEES, GuaranteesModule.builder().comment("Caution à venir").build());

        GuaranteesModule guarantees = store.readModule(ModuleKey.GUARANTEES).orElseThrow();
        assertThat(guarantees.getDossierId()).isEqualTo(DOSSIER_ID);
        assertThat(guarantees.getUpdatedAt()).isEqualTo(NOW);
        assertThat(guarantees.getItems()).hasSize(1);
        assertThat(guarantees.getComment()).isEqualTo("Caution à venir");
        assertThat(guarantees.getGaps()).containsExactly("Hypothèque 1er rang (hypotheque) - non obtenue");
    }

    @Test
    void documentsPatchDerivesMissingTypesAndCompleteness() {
        store.upsertDossier(TestDossiers.completeDossier());
        DocumentsModule patch = TestDossiers.documents(DocumentItem.Status.VALIDATED, DocumentItem.Status.EXPECTED);
        patch.setRequired(List.of("kbis", "bilan", "permis"));

        store.patchModule(DOSSIER_ID, ModuleKey.DOCUMENTS, patch);

        DocumentsModule documents = store.readModule(ModuleKey.DOCUMENTS).orElseThrow();
        assertThat(documents.getMissing()).containsExactly("bilan", "permis");
        assertThat(documents.getCompletenessPct()).isEqualTo(50);
    }

    @Test
    void removingActiveDossierPurgesEveryModule() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.patchModule(DOSSIER_ID, ModuleKey.GUARANTEES,
                TestDossiers.guarantees(200_000, GuaranteeItem.Status.OBTAINED));
        store.patchModule(DOSSIER_ID, ModuleKey.DOCUMENTS, TestDossiers.documents(DocumentItem.Status.RECEIVED));

        assertThat(store.removeDossier("dos-other")).isFalse();
        assertThat(store.read().getGuarantees()).isNotNull();

        assertThat(store.removeDossier(DOSSIER_ID)).isTrue();

        Snapshot snapshot = store.read();
        assertThat(snapshot.getDossier()).isNull();
        assertThat(snapshot.getActiveDossierId()).isNull();
        for (ModuleKey<?> moduleKey : ModuleKey.values()) {
            assertThat(moduleKey.get(snapshot)).as(moduleKey.name()).isNull();
        }
    }

    @Test
    void updateStatusAndAttachReport() {
        store.upsertDossier(TestDossiers.completeDossier());
        StructuredReport report = new StructuredReport(NOW, new ReportMeta(DOSSIER_ID, "Test", "REF", null),
                null, null, null, null, null, null, null, null, null, null, null, null, null);

        assertThat(store.updateStatus(DOSSIER_ID, DossierStatus.COMITE)).isTrue();
        assertThat(store.attachReport(DOSSIER_ID, report)).isTrue();

        Dossier dossier = store.readActiveDossier().orElseThrow();
        assertThat(dossier.getStatus()).isEqualTo(DossierStatus.COMITE);
        assertThat(dossier.getReportGenerated()).isTrue();
        assertThat(dossier.getReport()).isEqualTo(report);
    }

    @Test
    void alertsCanBeAcknowledgedReplacedAndRemoved() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.upsertAlert(DOSSIER_ID, alert("manual-1", "manual.check"));
        store.upsertAlert(DOSSIER_ID, alert("score-1", "smartscore.low_score"));

        assertThat(store.acknowledgeAlert(DOSSIER_ID, "manual-1")).isTrue();
        assertThat(store.acknowledgeAlert(DOSSIER_ID, "unknown")).isFalse();
        assertThat(store.replaceAlerts(DOSSIER_ID, "smartscore.", List.of(alert("score-2", "smartscore.blockers"))))
                .isTrue();

        List<MonitoringAlert> alerts = store.read().getMonitoring().getAlerts();
        assertThat(alerts).extracting(MonitoringAlert::id)
                .contains("manual-1", "score-2")
                .doesNotContain("score-1");
        assertThat(alerts).filteredOn(a -> a.id().equals("manual-1"))
                .singleElement()
                .satisfies(a -> assertThat(a.acknowledgedAt()).isEqualTo(NOW));

        assertThat(store.removeAlert(DOSSIER_ID, "manual-1")).isTrue();
        assertThat(store.removeAlert(DOSSIER_ID, "manual-1")).isFalse();
    }

    @Test
    void monitoringRulesAreReplacedWithoutARun() {
        store.upsertDossier(TestDossiers.completeDossier());

        store.patchMonitoringRules(DOSSIER_ID, List.of(MonitoringRule.builder().key("ltv_exceeded").build()));

        assertThat(store.read().getMonitoring().getRules()).extracting(MonitoringRule::key)
                .containsExactly("ltv_exceeded");
        assertThat(store.read().getMonitoring().getLastRunAt()).isNull();
        assertThat(store.patchMonitoringRules("dos-stale", List.of())).isFalse();
    }

    @Test
    void replacingAlertsStampsLastRun() {
        store.upsertDossier(TestDossiers.completeDossier());

        store.replaceAlerts(DOSSIER_ID, "rules.", List.of());

        assertThat(store.read().getMonitoring().getLastRunAt()).isEqualTo(NOW);
    }

    @Test
    void listenerRegisteredTwiceIsNotifiedOnce() {
        List<SnapshotChangeEvent> events = new ArrayList<>();
        SnapshotListener listener = events::add;

        Subscription first = store.onChange(listener);
        Subscription second = store.onChange(listener);
        store.upsertDossier(TestDossiers.completeDossier());

        assertThat(second).isSameAs(first);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).remote()).isFalse();
        assertThat(events.get(0).key()).isEqualTo(KEY);
        assertThat(events.get(0).snapshot().getDossier().getId()).isEqualTo(DOSSIER_ID);

        first.unsubscribe();
        first.unsubscribe();
        store.updateStatus(DOSSIER_ID, DossierStatus.ANALYSE);
        assertThat(events).hasSize(1);
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        List<SnapshotChangeEvent> events = new ArrayList<>();
        store.onChange(event -> {
            throw new IllegalStateException("boom");
        });
        store.onChange(events::add);

        store.upsertDossier(TestDossiers.completeDossier());

        assertThat(events).hasSize(1);
        assertThat(store.readActiveDossier()).isPresent();
    }

    @Test
    void otherContextSharingTheKeySeesTheWrite() {
        InProcessSnapshotChangeRelay relay = new InProcessSnapshotChangeRelay();
        InMemorySnapshotBackend shared = new InMemorySnapshotBackend();
        BanqueSnapshotStore writer = TestDossiers.store(shared, relay);
        BanqueSnapshotStore reader = TestDossiers.store(shared, relay);
        List<SnapshotChangeEvent> writerEvents = new ArrayList<>();
        List<SnapshotChangeEvent> readerEvents = new ArrayList<>();
        writer.onChange(writerEvents::add);
        reader.onChange(readerEvents::add);
        assertThat(reader.read().getDossier()).isNull();

        writer.upsertDossier(TestDossiers.completeDossier());

        assertThat(writerEvents).extracting(SnapshotChangeEvent::remote).containsExactly(false);
        assertThat(readerEvents).extracting(SnapshotChangeEvent::remote).containsExactly(true);
        assertThat(readerEvents.get(0).snapshot().getDossier().getId()).isEqualTo(DOSSIER_ID);
        assertThat(reader.read().getDossier().getId()).isEqualTo(DOSSIER_ID);

        reader.close();
        writer.updateStatus(DOSSIER_ID, DossierStatus.ANALYSE);
        assertThat(readerEvents).hasSize(1);
    }

    @Test
    void persistenceFailureKeepsInMemoryStateAndNotifies() {
        SnapshotBackend failing = mock(SnapshotBackend.class);
        when(failing.load(anyString())).thenReturn(Optional.empty());
        doThrow(new SnapshotPersistenceException("disk full", null)).when(failing).save(anyString(), anyString());
        BanqueSnapshotStore fragile = TestDossiers.bareStore(failing);
        List<SnapshotChangeEvent> events = new ArrayList<>();
        fragile.onChange(events::add);

        Dossier written = fragile.upsertDossier(TestDossiers.completeDossier());

        assertThat(written.getId()).isEqualTo(DOSSIER_ID);
        assertThat(events).hasSize(1);
        assertThat(fragile.readActiveDossier()).isPresent();
    }

    @Test
    void corruptPayloadReadsAsEmpty() {
        backend.save(KEY, "{\"dossier\": [not json");

        Snapshot snapshot = store.read();

        assertThat(snapshot.getDossier()).isNull();
        assertThat(snapshot.getVersion()).isEqualTo(Snapshot.CURRENT_VERSION);
    }

    @Test
    void clearResetsTheSnapshot() {
        store.upsertDossier(TestDossiers.completeDossier());

        List<SnapshotChangeEvent> events = new ArrayList<>();
        store.onChange(events::add);

        store.clear();

        assertThat(backend.load(KEY)).isEmpty();
        assertThat(store.read().getDossier()).isNull();
        assertThat(store.read().getMonitoring()).isNull();
        assertThat(events).singleElement()
                .satisfies(event -> assertThat(event.snapshot().getDossier()).isNull());
    }

    @Test
    void clearSurvivesBackendFailure() {
        SnapshotBackend failing = mock(SnapshotBackend.class);
        when(failing.load(anyString())).thenReturn(Optional.empty());
        doThrow(new SnapshotPersistenceException("read-only", null)).when(failing).delete(anyString());
        BanqueSnapshotStore fragile = TestDossiers.bareStore(failing);
        fragile.upsertDossier(TestDossiers.completeDossier());

        fragile.clear();

        verify(failing).delete(KEY);
        assertThat(fragile.read().getDossier()).isNull();
    }

    @Test
    void clearModuleDropsOnlyThatModule() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.patchModule(DOSSIER_ID, ModuleKey.GUARANTEES,
                TestDossiers.guarantees(200_000, GuaranteeItem.Status.OBTAINED));

        store.clearModule(ModuleKey.GUARANTEES);

        assertThat(store.read().getGuarantees()).isNull();
        assertThat(store.read().getDossier()).isNotNull();
    }

    private static MonitoringAlert alert(String id, String ruleKey) {
        return MonitoringAlert.builder()
                .id(id)
                .dossierId(DOSSIER_ID)
                .severity(AlertSeverity.INFO)
                .ruleKey(ruleKey)
                .title("Alerte")
                .message("Message")
                .createdAt(NOW)
                .build();
    }
}
