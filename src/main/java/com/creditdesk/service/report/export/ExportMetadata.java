package com.creditdesk.service.report.export;

import com.creditdesk.model.dossier.Dossier;

import java.time.Instant;

/**
 * Display identity of the dossier owning an exported report.
 */
public record ExportMetadata(
        String dossierId,
        String reference,
        String label,
        String borrowerName,
        Instant generatedAt
) {
    public ExportMetadata {
        if (dossierId == null || dossierId.isBlank()) {
            throw new IllegalArgumentException("dossierId is required");
        }
    }

    public static ExportMetadata of(Dossier dossier) {
        return new ExportMetadata(
                dossier.getId(),
                dossier.getReference(),
                dossier.getLabel(),
                dossier.getBorrower() == null ? null : dossier.getBorrower().displayName(),
                dossier.getReport() == null ? null : dossier.getReport().generatedAt());
    }

    /**
     * File name stem: the reference when known, else the dossier id, restricted to file-safe characters.
     */
    public String fileNameStem() {
        String base = reference == null || reference.isBlank() ? dossierId : reference;
        return "rapport-" + base.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
