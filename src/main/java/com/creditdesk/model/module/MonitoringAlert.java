package com.creditdesk.model.module;

import lombok.Builder;
import lombok.With;

import java.time.Instant;

/**
 * Append-only log entry: lifecycle events and rule-driven alerts share this shape.
 */
@Builder
@With
public record MonitoringAlert(
        String id,
        String dossierId,
        AlertSeverity severity,
        String title,
        String message,
        String ruleKey,
        Instant createdAt,
        Instant updatedAt,
        Instant acknowledgedAt
) {
}
