package com.questrail.busanomaly.observability;

import java.time.Instant;

/**
 * Record reporting the trailing words dropped while cutting traffic into
 * fixed-length sequences.
 */
public record SequenceTruncationEvent(
    Instant timestamp,
    int totalWords,
    int keptWords,
    int discardedWords,
    int wordsPerSequence
) {
}
