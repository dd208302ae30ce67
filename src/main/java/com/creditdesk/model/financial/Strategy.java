package com.creditdesk.model.financial;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Exit strategy of the financed operation.
 */
public enum Strategy {
    @JsonProperty("revente") RESALE,
    @JsonProperty("location") RENTAL
}
