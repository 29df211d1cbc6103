package com.questrail.busanomaly.reshape;

import com.questrail.busanomaly.api.TrafficRecord;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.TensorShape;
import com.questrail.busanomaly.core.TensorShapeException;
import com.questrail.busanomaly.core.Word;
import com.questrail.busanomaly.observability.AnomalyObservabilitySink;
import com.questrail.busanomaly.observability.SequenceTruncationEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SequenceReshaper
 * -----------------------------------------------------------------------------
 * Cuts an ordered stream of traffic records into non-overlapping, fixed-length
 * sequences.
 *
 * <h2>Window Length</h2>
 * The number of words per sequence is {@code P = floor(duration / samplingPeriod)},
 * computed on whole nanoseconds so that e.g. 3 s over 10 ms yields exactly 300.
 *
 * <h2>Truncation</h2>
 * Only whole windows are kept. Trailing words that do not fill a last window
 * are dropped; their count is returned in {@link ReshapeResult#discardedWords()}
 * and reported to the sink.
 */
public final class SequenceReshaper
{
    private final AnomalyObservabilitySink sink;

    public SequenceReshaper(AnomalyObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Returns the number of words per sequence for the given timing.
     *
     * @throws IllegalArgumentException if the sampling period is not positive
     * @throws TensorShapeException if the duration is shorter than one period
     */
    public static int wordsPerSequence(Duration samplingPeriod, Duration duration) {
        Objects.requireNonNull(samplingPeriod, "samplingPeriod");
        Objects.requireNonNull(duration, "duration");
        if (samplingPeriod.isZero() || samplingPeriod.isNegative()) {
            throw new IllegalArgumentException("samplingPeriod must be positive");
        }
        long p = duration.toNanos() / samplingPeriod.toNanos();
        if (p < 1) {
            throw new TensorShapeException(
                    "Duration " + duration + " is shorter than one sampling period " + samplingPeriod);
        }
        if (p > Integer.MAX_VALUE) {
            throw new TensorShapeException("Sequence length " + p + " is too large");
        }
        return (int) p;
    }

    /**
     * Builds the {@code (split, P, W)} tensor of test sequences.
     *
     * @param records        traffic of a single identifier, in arrival order
     * @param samplingPeriod nominal period between two messages of the identifier
     * @param duration       time covered by one sequence
     * @throws TensorShapeException if there are no records or payload widths differ
     */
    public ReshapeResult createTestSequences(List<? extends TrafficRecord> records,
                                             Duration samplingPeriod,
                                             Duration duration) {
        Objects.requireNonNull(records, "records");
        int p = wordsPerSequence(samplingPeriod, duration);

        if (records.isEmpty()) {
            throw new TensorShapeException("At least one record is required to infer the word width");
        }

        List<Word> words = new ArrayList<>(records.size());
        int width = -1;
        for (int i = 0; i < records.size(); i++) {
            Word w = Word.fromBinaryString(records.get(i).payloadBits());
            if (width < 0) {
                width = w.width();
            } else if (w.width() != width) {
                throw new TensorShapeException(
                        "Record " + i + " has a " + w.width() + "-bit payload, expected " + width);
            }
            words.add(w);
        }

        int split = words.size() / p;
        int kept = p * split;
        int discarded = words.size() - kept;

        if (discarded > 0) {
            sink.onSequencesTruncated(
                    new SequenceTruncationEvent(Instant.now(), words.size(), kept, discarded, p));
        }

        Tensor tensor = Tensor.reshape(words.subList(0, kept), new TensorShape(split, p, width));
        return new ReshapeResult(tensor, discarded);
    }
}
