package com.creditdesk.model.module;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * A security taken (or requested) against the loan.
 */
@Builder
public record GuaranteeItem(
        String id,
        Type type,
        String description,
        Double estimatedValue,
        Integer rank,
        Status status,
        String constitutedOn
) {
    public enum Type {
        @JsonProperty("hypotheque") HYPOTHEQUE,
        @JsonProperty("nantissement") NANTISSEMENT,
        @JsonProperty("caution") CAUTION,
        @JsonProperty("gage") GAGE,
        @JsonProperty("autre") AUTRE
    }

    public enum Status {
        @JsonProperty("demandee") REQUESTED,
        @JsonProperty("obtenue") OBTAINED
    }
}
