package com.creditdesk;

import com.creditdesk.model.ModuleKey;
import com.creditdesk.model.module.GuaranteeItem;
import com.creditdesk.model.report.ReportValidity;
import com.creditdesk.model.report.StructuredReport;
import com.creditdesk.service.report.ReportService;
import com.creditdesk.service.store.BanqueSnapshotStore;
import com.creditdesk.util.TestDossiers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static com.creditdesk.util.TestDossiers.DOSSIER_ID;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class CreditDeskApplicationTest {

    @Autowired
    private BanqueSnapshotStore store;

    @Autowired
    private ReportService reportService;

    @AfterEach
    void tearDown() {
        store.clear();
    }

    @Test
    void storeIsWiredOnConfiguredKey() {
        assertThat(store.key()).isEqualTo("test.banque.snapshot");
        assertThat(store.read().getDossier()).isNull();
    }

    @Test
    void reportPipelineRunsOnWiredBeans() {
        store.upsertDossier(TestDossiers.completeDossier());
        store.patchModule(DOSSIER_ID, ModuleKey.GUARANTEES,
                TestDossiers.guarantees(250_000, GuaranteeItem.Status.OBTAINED));

        StructuredReport report = reportService.generate(DOSSIER_ID);

        assertThat(report.guarantees().coverageRatioPct()).isEqualTo(139);
        assertThat(reportService.validity(DOSSIER_ID)).isEqualTo(ReportValidity.VALID);
        assertThat(store.read().getGuarantees().getGaps()).isEmpty();
    }
}
