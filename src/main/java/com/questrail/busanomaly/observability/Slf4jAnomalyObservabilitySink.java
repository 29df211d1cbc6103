package com.questrail.busanomaly.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of AnomalyObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jAnomalyObservabilitySink implements AnomalyObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAnomalyObservabilitySink.class);

    @Override
    public void onFieldAnomalyOnset(FieldAnomalyOnsetEvent event) {
        log.info("Anomaly will start at {}, with length {}", event.onset(), event.anomalyWordCount());
        log.info("The data for the chosen field is: Start bit: {} | Length: {}",
            event.fieldStartBit(), event.fieldLength());
    }

    @Override
    public void onTargetFieldUnavailable(TargetFieldUnavailableEvent event) {
        log.info("No fields of variability {} exist among {} fields",
            event.category(), event.fieldsInspected());
    }

    @Override
    public void onSequencesTruncated(SequenceTruncationEvent event) {
        log.debug("Discarded {} of {} words; {} words fill whole {}-word sequences",
            event.discardedWords(), event.totalWords(), event.keptWords(), event.wordsPerSequence());
    }

    @Override
    public void onAnomalyGenerated(AnomalyGeneratedEvent event) {
        log.debug("Generated '{}' anomaly: {} -> {}",
            event.label(), event.inputShape(), event.outputShape());
    }
}
