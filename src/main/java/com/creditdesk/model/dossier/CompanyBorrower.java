package com.creditdesk.model.dossier;

import lombok.Builder;

/**
 * Company borrower (SCI, SCCV, SAS...).
 */
@Builder
public record CompanyBorrower(
        String companyName,
        String legalForm,
        String sirenSiret,
        String legalRepresentative,
        String headOfficeAddress,
        String email,
        String phone
) implements Borrower {

    @Override
    public String displayName() {
        return companyName == null || companyName.isBlank() ? "Non renseigné" : companyName;
    }
}
