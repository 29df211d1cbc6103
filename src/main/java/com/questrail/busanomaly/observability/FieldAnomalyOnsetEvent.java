package com.questrail.busanomaly.observability;

import java.time.Instant;

/**
 * Record describing where a field anomaly starts and which bits it covers.
 */
public record FieldAnomalyOnsetEvent(
    Instant timestamp,
    int onset,
    int anomalyWordCount,
    int fieldStartBit,
    int fieldLength
) {
}
