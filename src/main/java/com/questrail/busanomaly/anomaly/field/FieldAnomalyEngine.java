package com.questrail.busanomaly.anomaly.field;

import com.questrail.busanomaly.anomaly.DonorRotation;
import com.questrail.busanomaly.api.LabeledTensor;
import com.questrail.busanomaly.core.Tensor;
import com.questrail.busanomaly.core.TensorShapeException;
import com.questrail.busanomaly.core.Word;
import com.questrail.busanomaly.field.Field;
import com.questrail.busanomaly.observability.AnomalyObservabilitySink;
import com.questrail.busanomaly.observability.FieldAnomalyOnsetEvent;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * FieldAnomalyEngine
 * -----------------------------------------------------------------------------
 * Corrupts one field over a contiguous run of words, leaving every other bit
 * of the tensor untouched.
 *
 * <h2>Onset</h2>
 * One onset {@code s} is drawn uniformly from
 * {@code [floor(P / 3), P - count - 1]} and shared by every sequence. The run
 * covers positions {@code [s, s + count]} inclusive, i.e. {@code count + 1}
 * words per sequence. The lower bound keeps the anomaly out of the first
 * third of a sequence; the upper bound keeps it inside the sequence.
 *
 * <h2>Replay Donors</h2>
 * Affected words are visited sequence by sequence, in word order. The
 * {@code k}-th affected word replays from sequence
 * {@code (floor(N / 3) + k) mod N}; the rotation is not reset between
 * sequences. Donor words are always read from the input tensor.
 *
 * <h2>Sessions</h2>
 * Every call runs with a fresh {@link MutationSession}, so a
 * {@link FieldMutation#RANDOM_CONSTANT} value is shared within one call and
 * never across calls.
 */
public final class FieldAnomalyEngine
{
    private final Random random;
    private final AnomalyObservabilitySink sink;

    public FieldAnomalyEngine(Random random, AnomalyObservabilitySink sink) {
        this.random = Objects.requireNonNull(random, "random");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Creates a field anomaly.
     *
     * @param sequences         input tensor; not modified
     * @param field             field to corrupt
     * @param anomalyWordCount  run length; {@code anomalyWordCount + 1} words are affected
     * @param mutation          how the field is rewritten
     * @param verbose           report onset and field geometry to the sink
     * @return the anomalous tensor labeled with {@link FieldMutation#label()}
     * @throws TensorShapeException if the field does not fit the words or the
     *         run cannot be placed after the first third of a sequence
     */
    public LabeledTensor createFieldAnomaly(Tensor sequences,
                                            Field field,
                                            int anomalyWordCount,
                                            FieldMutation mutation,
                                            boolean verbose) {
        Objects.requireNonNull(sequences, "sequences");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(mutation, "mutation");
        if (anomalyWordCount < 0) {
            throw new IllegalArgumentException("anomalyWordCount must be non-negative");
        }
        if (field.endBit() >= sequences.bitsPerWord()) {
            throw new TensorShapeException(
                    "Field [" + field.startBit() + ".." + field.endBit() + "] lies outside a "
                            + sequences.bitsPerWord() + "-bit word");
        }

        int n = sequences.sequenceCount();
        int p = sequences.wordsPerSequence();
        int onset = drawOnset(p, anomalyWordCount);

        if (verbose) {
            sink.onFieldAnomalyOnset(new FieldAnomalyOnsetEvent(
                    Instant.now(), onset, anomalyWordCount, field.startBit(), field.length()));
        }

        MutationSession session = new MutationSession(random);
        WordMutator mutator = mutation.bind(session);

        int perSequence = anomalyWordCount + 1;
        int[] donors = mutation.requiresDonor()
                ? DonorRotation.sequence(n / 3, Math.max(n, 1), n * perSequence)
                : new int[0];

        List<Word> out = sequences.flatten();
        int step = 0;
        for (int i = 0; i < n; i++) {
            for (int j = onset; j <= onset + anomalyWordCount; j++) {
                Optional<Word> donor = mutation.requiresDonor()
                        ? Optional.of(sequences.word(donors[step], j))
                        : Optional.empty();
                MutationResult result = mutator.mutate(field, sequences.word(i, j), donor);
                out.set(i * p + j, result.word());
                step++;
            }
        }

        return new LabeledTensor(Tensor.reshape(out, sequences.shape()), mutation.label());
    }

    private int drawOnset(int wordsPerSequence, int anomalyWordCount) {
        int lowest = wordsPerSequence / 3;
        int highest = wordsPerSequence - anomalyWordCount - 1;
        if (highest < lowest) {
            throw new TensorShapeException(
                    "A run of " + (anomalyWordCount + 1) + " words cannot start after position "
                            + lowest + " in sequences of " + wordsPerSequence + " words");
        }
        return lowest + random.nextInt(highest - lowest + 1);
    }
}
