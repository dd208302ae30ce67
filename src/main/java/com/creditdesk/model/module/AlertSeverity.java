package com.creditdesk.model.module;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AlertSeverity {
    @JsonProperty("info") INFO,
    @JsonProperty("warn") WARN,
    @JsonProperty("critical") CRITICAL
}
