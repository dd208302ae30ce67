package com.creditdesk.model.report;

import com.creditdesk.model.dossier.DossierStatus;

public record ReportMeta(
        String dossierId,
        String dossierLabel,
        String reference,
        DossierStatus status
) {
}
