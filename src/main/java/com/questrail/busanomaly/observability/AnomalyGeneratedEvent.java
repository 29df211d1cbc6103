package com.questrail.busanomaly.observability;

import com.questrail.busanomaly.core.TensorShape;

import java.time.Instant;

/**
 * Record describing one produced anomalous tensor.
 */
public record AnomalyGeneratedEvent(
    Instant timestamp,
    String label,
    TensorShape inputShape,
    TensorShape outputShape
) {
}
