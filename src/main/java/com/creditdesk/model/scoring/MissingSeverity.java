package com.creditdesk.model.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MissingSeverity {
    @JsonProperty("blocker") BLOCKER,
    @JsonProperty("warn") WARN,
    @JsonProperty("info") INFO
}
