package com.questrail.busanomaly.observability;

/**
 * Main interface for receiving anomaly-generation observability events.
 * Implementations can provide logging, metrics, or test recording.
 * <p>
 * Sinks are a side channel: nothing they do may influence the tensors being
 * generated.
 */
public interface AnomalyObservabilitySink {
    /**
     * Called when a field anomaly has chosen its onset (verbose mode only).
     * @param event onset and field geometry
     */
    void onFieldAnomalyOnset(FieldAnomalyOnsetEvent event);

    /**
     * Called when no field of the requested variability category exists.
     * @param event the requested category
     */
    void onTargetFieldUnavailable(TargetFieldUnavailableEvent event);

    /**
     * Called when reshaping discards trailing words that do not fill a window.
     * @param event word counts before and after truncation
     */
    void onSequencesTruncated(SequenceTruncationEvent event);

    /**
     * Called after an anomalous tensor has been produced.
     * @param event label and resulting shape
     */
    void onAnomalyGenerated(AnomalyGeneratedEvent event);
}
