package com.creditdesk.service.profitability;

import com.creditdesk.model.dossier.AnalysisSection;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.financial.ProfitabilityAnalysis;
import com.creditdesk.model.financial.ProfitabilityForm;
import com.creditdesk.model.financial.ProfitabilityInput;
import com.creditdesk.service.store.BanqueSnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Runs the calculator for the active dossier and writes the analysis back into
 * {@code dossier.analysis} through the store. The calculator itself never writes.
 *
 * Only an analyst's form is kept as {@code profitabilityInput}. Without one,
 * every run re-derives its input from the current budget, revenue and
 * origination sections.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfitabilityService {

    private final BanqueSnapshotStore store;
    private final ProfitabilityCalculator calculator;
    private final ProfitabilityInputMapper inputMapper;
    private final Clock clock;

    /**
     * Compute from the analyst's form and keep the parsed input for later runs.
     */
    public ProfitabilityAnalysis computeFromForm(String dossierId, ProfitabilityForm form) {
        requireActive(dossierId);
        return computeAndSave(dossierId, inputMapper.fromForm(form), true);
    }

    /**
     * Compute from the saved form input, or from the dossier sections as they are now.
     */
    public ProfitabilityAnalysis compute(String dossierId) {
        Dossier dossier = requireActive(dossierId);
        AnalysisSection analysis = dossier.getAnalysis();
        if (analysis != null && analysis.getProfitabilityInput() != null) {
            return computeAndSave(dossierId, analysis.getProfitabilityInput(), false);
        }
        return computeAndSave(dossierId, inputMapper.fromDossier(dossier), false);
    }

    private ProfitabilityAnalysis computeAndSave(String dossierId, ProfitabilityInput input, boolean keepInput) {
        ProfitabilityAnalysis result = calculator.computeAll(input, clock.instant());
        // A null input is left out of the merge
        store.upsertDossier(Dossier.builder()
                .id(dossierId)
                .analysis(AnalysisSection.builder()
                        .profitabilityInput(keepInput ? input : null)
                        .profitability(result)
                        .build())
                .build());
        log.info("Profitability computed for dossier {}: {} (margin {} %)",
                dossierId, result.base().decision(), result.base().marginPct());
        return result;
    }

    private Dossier requireActive(String dossierId) {
        return store.readActiveDossier()
                .filter(dossier -> dossier.getId().equals(dossierId))
                .orElseThrow(() -> new IllegalStateException("Dossier " + dossierId + " is not the active dossier"));
    }
}
