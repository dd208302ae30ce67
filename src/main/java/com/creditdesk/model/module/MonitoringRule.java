package com.creditdesk.model.module;

import lombok.Builder;

@Builder
public record MonitoringRule(
        String key,
        String label,
        Boolean enabled,
        Double threshold
) {
}
