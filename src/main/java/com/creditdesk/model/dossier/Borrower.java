package com.creditdesk.model.dossier;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Borrower of a dossier: either a natural person or a company.
 * The {@code type} discriminator is part of the persisted layout.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PersonBorrower.class, name = "personne_physique"),
        @JsonSubTypes.Type(value = CompanyBorrower.class, name = "personne_morale")
})
public sealed interface Borrower permits PersonBorrower, CompanyBorrower {

    /** Display identity ("Prénom Nom" or company name), never null. */
    String displayName();
}
