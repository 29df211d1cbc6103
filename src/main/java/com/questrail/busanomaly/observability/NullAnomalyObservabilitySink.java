package com.questrail.busanomaly.observability;

/**
 * No-op implementation of AnomalyObservabilitySink.
 */
public final class NullAnomalyObservabilitySink implements AnomalyObservabilitySink {
    public static final NullAnomalyObservabilitySink INSTANCE = new NullAnomalyObservabilitySink();

    private NullAnomalyObservabilitySink() {}

    @Override
    public void onFieldAnomalyOnset(FieldAnomalyOnsetEvent event) {}

    @Override
    public void onTargetFieldUnavailable(TargetFieldUnavailableEvent event) {}

    @Override
    public void onSequencesTruncated(SequenceTruncationEvent event) {}

    @Override
    public void onAnomalyGenerated(AnomalyGeneratedEvent event) {}
}
