package com.questrail.busanomaly.observability;

import com.questrail.busanomaly.field.FieldVariability;

import java.time.Instant;

/**
 * Record reporting that no field of the requested category was available.
 */
public record TargetFieldUnavailableEvent(
    Instant timestamp,
    FieldVariability category,
    int fieldsInspected
) {
}
