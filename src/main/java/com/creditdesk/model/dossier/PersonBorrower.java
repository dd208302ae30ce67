package com.creditdesk.model.dossier;

import lombok.Builder;

/**
 * Natural person borrower.
 */
@Builder
public record PersonBorrower(
        String firstName,
        String lastName,
        String birthDate,
        String nationality,
        String address,
        String email,
        String phone
) implements Borrower {

    @Override
    public String displayName() {
        String name = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        return name.isEmpty() ? "Non renseigné" : name;
    }
}
