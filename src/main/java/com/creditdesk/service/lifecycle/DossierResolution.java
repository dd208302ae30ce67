package com.creditdesk.service.lifecycle;

/**
 * Outcome of {@link DossierGuard#resolve}: a dossier to work on, or the
 * instruction to send the user to the dossier selection.
 */
public record DossierResolution(Outcome outcome, String dossierId) {

    public enum Outcome {
        PROCEED,
        SELECT_DOSSIER
    }

    public DossierResolution {
        if (outcome == Outcome.PROCEED && (dossierId == null || dossierId.isBlank())) {
            throw new IllegalArgumentException("Dossier ID cannot be null or empty when proceeding");
        }
    }

    public static DossierResolution proceed(String dossierId) {
        return new DossierResolution(Outcome.PROCEED, dossierId);
    }

    public static DossierResolution selectDossier() {
        return new DossierResolution(Outcome.SELECT_DOSSIER, null);
    }

    public boolean proceeding() {
        return outcome == Outcome.PROCEED;
    }
}
