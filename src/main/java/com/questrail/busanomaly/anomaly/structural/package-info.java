/**
 * Whole-tensor anomalies that corrupt ordering and continuity: interleave,
 * discontinuity, reverse and drop.
 */
package com.questrail.busanomaly.anomaly.structural;
